package me.golemcore.toolrouter.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolrouter.infrastructure.config.ToolRouterProperties;
import me.golemcore.toolrouter.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of {@link StoragePort}.
 *
 * <p>
 * Layout under the base path:
 * <ul>
 * <li>catalog/&lt;tool&gt;/&lt;version&gt;.json - published tool versions
 * <li>telemetry/&lt;yyyy-MM-dd&gt;.jsonl - step telemetry, append-only
 * </ul>
 *
 * <p>
 * Base path configured via {@code toolrouter.storage.local.base-path}, defaults
 * to {@code ${user.home}/.golemcore/toolrouter}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    static final List<String> KNOWN_DIRECTORIES = List.of("catalog", "telemetry");

    private final ToolRouterProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        String configured = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(configured.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            for (String dir : KNOWN_DIRECTORIES) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Local storage at {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directories under {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(directory, path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = resolvePath(directory, "");
            Path start = prefix == null || prefix.isEmpty() ? dir : resolvePath(directory, prefix);
            if (!Files.exists(start)) {
                return List.of();
            }
            try (Stream<Path> paths = Files.walk(start)) {
                return paths
                        .filter(Files::isRegularFile)
                        .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
                        .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> appendText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolvePath(directory, path);
            try {
                createParent(file);
                Files.writeString(file, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append to " + directory + "/" + path, e);
            }
        });
    }

    /**
     * Temp file with fsync, optional {@code .bak} copy of the previous content,
     * then an atomic rename over the target. Readers see either the old or the
     * new file, never a partial one.
     */
    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path target = resolvePath(directory, path);
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            try {
                createParent(target);
                try (OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
                        FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    out.write(content.getBytes(StandardCharsets.UTF_8));
                    out.flush();
                    channel.force(true);
                }
                if (backup && Files.exists(target)) {
                    Files.copy(target, target.resolveSibling(target.getFileName() + ".bak"),
                            StandardCopyOption.REPLACE_EXISTING);
                }
                try {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, falling back to plain move for {}", target);
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException e) {
                deleteQuietly(temp);
                throw new UncheckedIOException("Atomic write failed for " + directory + "/" + path, e);
            }
        });
    }

    Path getBasePath() {
        return basePath;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath.resolve(directory).normalize())) {
            throw new IllegalArgumentException("Path escapes storage directory: " + directory + "/" + path);
        }
        return resolved;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanup) {
            log.warn("[Storage] Failed to remove temp file {}: {}", temp, cleanup.getMessage());
        }
    }
}
