package me.golemcore.runtime.testsupport.fakes;

import me.golemcore.runtime.domain.model.ToolResult;
import me.golemcore.runtime.port.outbound.ToolResultPort;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Keeps every posted result in posting order.
 */
public class RecordingToolResultPort implements ToolResultPort {

    private final List<Posted> posted = new ArrayList<>();

    @Override
    public synchronized CompletableFuture<Void> postResult(String invocationId, ToolResult result) {
        posted.add(new Posted(invocationId, result));
        return CompletableFuture.completedFuture(null);
    }

    public synchronized List<Posted> posted() {
        return List.copyOf(posted);
    }

    public synchronized List<ToolResult> resultsFor(String invocationId) {
        return posted.stream().filter(p -> p.invocationId().equals(invocationId)).map(Posted::result).toList();
    }

    public synchronized Map<String, Integer> countsById() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        posted.forEach(p -> counts.merge(p.invocationId(), 1, Integer::sum));
        return counts;
    }

    public record Posted(String invocationId, ToolResult result) {
    }
}
