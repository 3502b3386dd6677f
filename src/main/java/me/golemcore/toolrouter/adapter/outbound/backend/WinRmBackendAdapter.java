package me.golemcore.toolrouter.adapter.outbound.backend;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.domain.exception.StepExecutionException;
import me.golemcore.toolrouter.domain.model.CancellationToken;
import me.golemcore.toolrouter.domain.model.EnrichedExecutionStep;
import me.golemcore.toolrouter.domain.model.HostCredentials;
import me.golemcore.toolrouter.domain.model.StepResult;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.BackendAdapterPort;
import me.golemcore.toolrouter.port.outbound.CredentialResolverPort;
import okhttp3.Call;
import okhttp3.Credentials;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a command on a Windows host over WS-Management (WinRM) using the shared
 * OkHttp client. Location key {@code winrm}.
 *
 * <p>
 * One step is one remote shell: create shell, run command, poll output until
 * the command reports done, delete shell. Cancellation aborts the in-flight
 * request and sends a terminate signal before deleting the shell.
 *
 * <p>
 * Understood {@code protocolMetadata} keys: {@code command} (required),
 * {@code shell} ({@code cmd} or {@code powershell}, overriding
 * {@code toolrouter.backends.winrm.shell}), {@code port}, {@code https}.
 * Credentials are required and sent as HTTP Basic authentication.
 */
@Component
@Slf4j
public class WinRmBackendAdapter implements BackendAdapterPort {

    static final String NS_SHELL = "http://schemas.microsoft.com/wbem/wsman/1/windows/shell";
    private static final String NS_SOAP = "http://www.w3.org/2003/05/soap-envelope";
    private static final String NS_ADDRESSING = "http://schemas.xmlsoap.org/ws/2004/08/addressing";
    private static final String NS_WSMAN = "http://schemas.dmtf.org/wbem/wsman/1/wsman.xsd";
    private static final String RESOURCE_CMD = NS_SHELL + "/cmd";
    private static final String ACTION_CREATE = "http://schemas.xmlsoap.org/ws/2004/09/transfer/Create";
    private static final String ACTION_DELETE = "http://schemas.xmlsoap.org/ws/2004/09/transfer/Delete";
    private static final String ACTION_COMMAND = NS_SHELL + "/Command";
    private static final String ACTION_RECEIVE = NS_SHELL + "/Receive";
    private static final String ACTION_SIGNAL = NS_SHELL + "/Signal";
    private static final String SIGNAL_TERMINATE = NS_SHELL + "/signal/terminate";
    private static final String STATE_DONE = NS_SHELL + "/CommandState/Done";
    private static final String OPERATION_TIMEOUT_FAULT = "2150858793";
    private static final MediaType SOAP = MediaType.parse("application/soap+xml;charset=UTF-8");
    private static final int MAX_OUTPUT_CHARS = 100_000;

    private final OkHttpClient httpClient;
    private final ToolRouterProperties.WinRmProperties config;
    private final CredentialResolverPort credentialResolver;

    public WinRmBackendAdapter(OkHttpClient httpClient, ToolRouterProperties properties,
            CredentialResolverPort credentialResolver) {
        this.httpClient = httpClient;
        this.config = properties.getBackends().getWinrm();
        this.credentialResolver = credentialResolver;
    }

    @Override
    public String getLocation() {
        return "winrm";
    }

    @Override
    public StepResult execute(EnrichedExecutionStep step, CancellationToken cancellation) {
        if (step.getTargetHost() == null || step.getTargetHost().isBlank()) {
            throw new StepExecutionException("WinRM step " + step.getId() + " has no targetHost");
        }
        HostCredentials credentials = BackendCredentials.forStep(credentialResolver,
                step.toBuilder().requiresCredentials(true).build())
                .orElseThrow(() -> new StepExecutionException("WinRM requires credentials"));
        if (credentials.username() == null || !credentials.hasPassword()) {
            throw new StepExecutionException("WinRM credentials for " + step.getTargetHost()
                    + " need both username and password");
        }
        Session session = new Session(endpoint(step), basicAuth(credentials), cancellation);
        String command = commandLine(step);
        log.debug("[WinRM] Step {} on {}", step.getId(), session.endpoint);

        String shellId = session.createShell();
        String commandId = null;
        try {
            commandId = session.runCommand(shellId, command);
            Output output = session.receiveUntilDone(shellId, commandId);
            String text = StepTemplates.truncate(output.stdout + output.stderr, MAX_OUTPUT_CHARS);
            if (output.exitCode != 0) {
                throw new StepExecutionException("Remote command exited with code " + output.exitCode,
                        output.exitCode, text, null);
            }
            return StepResult.success(text, output.exitCode);
        } finally {
            session.cleanup(shellId, commandId);
        }
    }

    String endpoint(EnrichedExecutionStep step) {
        String httpsOverride = StepTemplates.optionalString(step, "https");
        boolean https = httpsOverride != null ? Boolean.parseBoolean(httpsOverride) : config.isHttps();
        String port = StepTemplates.optionalString(step, "port");
        return (https ? "https" : "http") + "://" + step.getTargetHost() + ":"
                + (port != null ? port : String.valueOf(config.getPort())) + "/wsman";
    }

    String commandLine(EnrichedExecutionStep step) {
        String command = StepTemplates.render(StepTemplates.requiredString(step, "command"), step);
        String shell = StepTemplates.optionalString(step, "shell");
        if ("powershell".equalsIgnoreCase(shell != null ? shell : config.getShell())) {
            String encoded = Base64.getEncoder().encodeToString(command.getBytes(StandardCharsets.UTF_16LE));
            return "powershell -NoProfile -NonInteractive -EncodedCommand " + encoded;
        }
        return command;
    }

    private static String basicAuth(HostCredentials credentials) {
        String user = credentials.domain() != null && !credentials.domain().isBlank()
                ? credentials.domain() + "\\" + credentials.username()
                : credentials.username();
        return Credentials.basic(user, credentials.password());
    }

    static String envelope(String endpoint, String action, String shellId, String options, String body) {
        StringBuilder xml = new StringBuilder()
                .append("<s:Envelope xmlns:s=\"").append(NS_SOAP)
                .append("\" xmlns:a=\"").append(NS_ADDRESSING)
                .append("\" xmlns:w=\"").append(NS_WSMAN)
                .append("\" xmlns:rsp=\"").append(NS_SHELL).append("\">")
                .append("<s:Header>")
                .append("<a:To>").append(escape(endpoint)).append("</a:To>")
                .append("<a:ReplyTo><a:Address s:mustUnderstand=\"true\">")
                .append("http://schemas.xmlsoap.org/ws/2004/08/addressing/role/anonymous</a:Address></a:ReplyTo>")
                .append("<w:ResourceURI s:mustUnderstand=\"true\">").append(RESOURCE_CMD).append("</w:ResourceURI>")
                .append("<a:Action s:mustUnderstand=\"true\">").append(action).append("</a:Action>")
                .append("<a:MessageID>uuid:").append(UUID.randomUUID()).append("</a:MessageID>")
                .append("<w:MaxEnvelopeSize s:mustUnderstand=\"true\">153600</w:MaxEnvelopeSize>")
                .append("<w:OperationTimeout>PT20S</w:OperationTimeout>");
        if (shellId != null) {
            xml.append("<w:SelectorSet><w:Selector Name=\"ShellId\">").append(escape(shellId))
                    .append("</w:Selector></w:SelectorSet>");
        }
        if (options != null) {
            xml.append("<w:OptionSet>").append(options).append("</w:OptionSet>");
        }
        return xml.append("</s:Header><s:Body>").append(body).append("</s:Body></s:Envelope>").toString();
    }

    static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;")
                .replace("\"", "&quot;").replace("'", "&apos;");
    }

    static Document parse(String xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new StepExecutionException("Malformed WinRM response: " + e.getMessage(), e);
        }
    }

    static String firstText(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS(NS_SHELL, localName);
        return nodes.getLength() > 0 ? nodes.item(0).getTextContent().trim() : null;
    }

    /**
     * Output collected by the receive loop.
     */
    record Output(String stdout, String stderr, int exitCode) {
    }

    /**
     * One authenticated conversation with a WinRM endpoint.
     */
    private final class Session {

        private final String endpoint;
        private final String authorization;
        private final CancellationToken cancellation;
        private final AtomicReference<Call> inFlight = new AtomicReference<>();

        Session(String endpoint, String authorization, CancellationToken cancellation) {
            this.endpoint = endpoint;
            this.authorization = authorization;
            this.cancellation = cancellation;
            cancellation.onCancel(() -> {
                Call call = inFlight.get();
                if (call != null) {
                    call.cancel();
                }
            });
        }

        String createShell() {
            String options = "<w:Option Name=\"WINRS_NOPROFILE\">TRUE</w:Option>"
                    + "<w:Option Name=\"WINRS_CODEPAGE\">65001</w:Option>";
            String body = "<rsp:Shell><rsp:InputStreams>stdin</rsp:InputStreams>"
                    + "<rsp:OutputStreams>stdout stderr</rsp:OutputStreams></rsp:Shell>";
            Document response = send(envelope(endpoint, ACTION_CREATE, null, options, body), true);
            String shellId = firstText(response, "ShellId");
            if (shellId == null) {
                NodeList selectors = response.getElementsByTagNameNS(NS_WSMAN, "Selector");
                for (int i = 0; i < selectors.getLength() && shellId == null; i++) {
                    Element selector = (Element) selectors.item(i);
                    if ("ShellId".equals(selector.getAttribute("Name"))) {
                        shellId = selector.getTextContent().trim();
                    }
                }
            }
            if (shellId == null) {
                throw new StepExecutionException("WinRM did not return a shell id");
            }
            return shellId;
        }

        String runCommand(String shellId, String command) {
            String options = "<w:Option Name=\"WINRS_CONSOLEMODE_STDIN\">TRUE</w:Option>"
                    + "<w:Option Name=\"WINRS_SKIP_CMD_SHELL\">FALSE</w:Option>";
            String body = "<rsp:CommandLine><rsp:Command>" + escape(command) + "</rsp:Command></rsp:CommandLine>";
            String commandId = firstText(send(envelope(endpoint, ACTION_COMMAND, shellId, options, body), true),
                    "CommandId");
            if (commandId == null) {
                throw new StepExecutionException("WinRM did not return a command id");
            }
            return commandId;
        }

        Output receiveUntilDone(String shellId, String commandId) {
            StringBuilder stdout = new StringBuilder();
            StringBuilder stderr = new StringBuilder();
            String body = "<rsp:Receive><rsp:DesiredStream CommandId=\"" + escape(commandId)
                    + "\">stdout stderr</rsp:DesiredStream></rsp:Receive>";
            while (true) {
                if (cancellation.isCancelled()) {
                    throw new StepExecutionException("WinRM command cancelled", null,
                            stdout.toString() + stderr, null);
                }
                Document response = send(envelope(endpoint, ACTION_RECEIVE, shellId, null, body), false);
                if (response == null) {
                    continue;
                }
                NodeList streams = response.getElementsByTagNameNS(NS_SHELL, "Stream");
                for (int i = 0; i < streams.getLength(); i++) {
                    Element stream = (Element) streams.item(i);
                    String content = stream.getTextContent().trim();
                    if (content.isEmpty()) {
                        continue;
                    }
                    String decoded = new String(Base64.getDecoder().decode(content), StandardCharsets.UTF_8);
                    ("stderr".equals(stream.getAttribute("Name")) ? stderr : stdout).append(decoded);
                }
                NodeList states = response.getElementsByTagNameNS(NS_SHELL, "CommandState");
                if (states.getLength() > 0 && STATE_DONE.equals(((Element) states.item(0)).getAttribute("State"))) {
                    String exitCode = firstText(response, "ExitCode");
                    return new Output(stdout.toString(), stderr.toString(),
                            exitCode != null ? Integer.parseInt(exitCode) : 0);
                }
            }
        }

        void cleanup(String shellId, String commandId) {
            try {
                if (commandId != null && cancellation.isCancelled()) {
                    String body = "<rsp:Signal CommandId=\"" + escape(commandId) + "\"><rsp:Code>"
                            + SIGNAL_TERMINATE + "</rsp:Code></rsp:Signal>";
                    sendDetached(envelope(endpoint, ACTION_SIGNAL, shellId, null, body));
                }
                sendDetached(envelope(endpoint, ACTION_DELETE, shellId, null, ""));
            } catch (IOException | RuntimeException e) {
                log.warn("[WinRM] Failed to clean up shell {} on {}: {}", shellId, endpoint, e.getMessage());
            }
        }

        /**
         * Sends one request. Returns null for an operation-timeout fault when
         * {@code strict} is false, which the receive loop treats as "no output
         * yet".
         */
        private Document send(String envelope, boolean strict) {
            Call call = httpClient.newCall(request(envelope));
            inFlight.set(call);
            if (cancellation.isCancelled()) {
                call.cancel();
            }
            try (Response response = call.execute()) {
                ResponseBody responseBody = response.body();
                String xml = responseBody != null ? responseBody.string() : "";
                if (!response.isSuccessful()) {
                    if (!strict && xml.contains(OPERATION_TIMEOUT_FAULT)) {
                        return null;
                    }
                    throw new StepExecutionException("WinRM request failed with HTTP " + response.code(),
                            null, xml, null);
                }
                return parse(xml);
            } catch (IOException e) {
                if (call.isCanceled()) {
                    throw new StepExecutionException("WinRM command cancelled", e);
                }
                throw new StepExecutionException("WinRM request failed: " + e.getMessage(), e);
            } finally {
                inFlight.compareAndSet(call, null);
            }
        }

        private void sendDetached(String envelope) throws IOException {
            try (Response response = httpClient.newCall(request(envelope)).execute()) {
                if (!response.isSuccessful()) {
                    log.debug("[WinRM] Cleanup request returned HTTP {}", response.code());
                }
            }
        }

        private Request request(String envelope) {
            return new Request.Builder()
                    .url(endpoint)
                    .header("Authorization", authorization)
                    .post(RequestBody.create(envelope, SOAP))
                    .build();
        }
    }
}
