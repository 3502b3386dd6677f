package me.golemcore.toolrouter.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * External collaborator consulted when the top candidates are too close to
 * call. The escalator owns prompting limits, timeouts and output validation;
 * a judge only answers.
 *
 * <p>
 * The answer is expected to be a JSON object
 * {@code {"choice": "<candidate key>", "reason": "..."}} naming one of
 * {@code candidateKeys}.
 */
public interface TieBreakJudgePort {

    String getJudgeId();

    CompletableFuture<String> resolveTie(List<String> candidateKeys, String prompt);
}
