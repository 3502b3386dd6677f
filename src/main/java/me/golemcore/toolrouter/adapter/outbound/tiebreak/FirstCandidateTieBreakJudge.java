package me.golemcore.toolrouter.adapter.outbound.tiebreak;

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

import me.golemcore.toolrouter.port.outbound.TieBreakJudgePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic judge that keeps the scoring order by always naming the first
 * presented candidate. Registered as {@code first}; used when no LLM is wanted
 * and as the fallback judge.
 */
@Component
public class FirstCandidateTieBreakJudge implements TieBreakJudgePort {

    @Override
    public String getJudgeId() {
        return "first";
    }

    @Override
    public CompletableFuture<String> resolveTie(List<String> candidateKeys, String prompt) {
        if (candidateKeys.isEmpty()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("No candidates presented"));
        }
        String first = candidateKeys.get(0).replace("\\", "\\\\").replace("\"", "\\\"");
        return CompletableFuture.completedFuture(
                "{\"choice\": \"" + first + "\", \"reason\": \"highest deterministic score\"}");
    }
}
