package com.recbench.evaluation.task;

import com.recbench.evaluation.exception.TaskNotFoundException;
import com.recbench.evaluation.model.TaskSnapshot;
import com.recbench.evaluation.runner.CancellationToken;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * In-memory table of evaluation tasks. Terminal tasks are kept for a retention window and
 * bounded in number; eviction runs lazily on register and lookup.
 */
@Component
public class TaskRegistry {

    private final long retentionMillis;
    private final int maxRetained;
    private final Clock clock;
    private final ConcurrentHashMap<String, TaskEntry> tasks = new ConcurrentHashMap<>();

    public TaskRegistry(long retentionSeconds, int maxRetained, Clock clock) {
        this.retentionMillis = Math.max(1L, retentionSeconds) * 1000L;
        this.maxRetained = Math.max(1, maxRetained);
        this.clock = clock;
    }

    @Autowired
    public TaskRegistry(
            @Value("${evaluation.task.retention-seconds:3600}") long retentionSeconds,
            @Value("${evaluation.task.max-retained:200}") int maxRetained
    ) {
        this(retentionSeconds, maxRetained, Clock.systemUTC());
    }

    public TaskEntry register() {
        evictExpired();
        String taskId = UUID.randomUUID().toString();
        TaskEntry entry = new TaskEntry(TaskSnapshot.pending(taskId));
        tasks.put(taskId, entry);
        return entry;
    }

    public TaskSnapshot get(String taskId) {
        return entry(taskId).snapshot();
    }

    public TaskEntry entry(String taskId) {
        evictExpired();
        TaskEntry entry = taskId == null ? null : tasks.get(taskId);
        if (entry == null) {
            throw new TaskNotFoundException(taskId);
        }
        return entry;
    }

    public int size() {
        return tasks.size();
    }

    void evictExpired() {
        long now = clock.millis();
        tasks.entrySet().removeIf(e -> {
            Long finishedAt = e.getValue().finishedAtMillis;
            return finishedAt != null && now - finishedAt >= retentionMillis;
        });

        List<TaskEntry> terminal = tasks.values().stream()
                .filter(entry -> entry.finishedAtMillis != null)
                .sorted(Comparator.comparingLong(entry -> entry.finishedAtMillis))
                .collect(Collectors.toList());
        int excess = terminal.size() - maxRetained;
        for (int i = 0; i < excess; i++) {
            tasks.remove(terminal.get(i).snapshot().getTaskId());
        }
    }

    /**
     * Holder for one task. Only the task's coordinator calls {@link #update}; pollers read the
     * latest published snapshot.
     */
    public final class TaskEntry {
        private volatile TaskSnapshot snapshot;
        private volatile Long finishedAtMillis;
        private final CancellationToken cancellation = new CancellationToken();

        private TaskEntry(TaskSnapshot snapshot) {
            this.snapshot = snapshot;
        }

        public String taskId() {
            return snapshot.getTaskId();
        }

        public TaskSnapshot snapshot() {
            return snapshot;
        }

        public CancellationToken cancellation() {
            return cancellation;
        }

        public TaskSnapshot update(UnaryOperator<TaskSnapshot> transition) {
            TaskSnapshot next = transition.apply(snapshot);
            snapshot = next;
            if (next.getStatus().isTerminal()) {
                finishedAtMillis = clock.millis();
            }
            return next;
        }
    }
}
