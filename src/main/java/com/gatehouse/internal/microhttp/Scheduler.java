package com.gatehouse.internal.microhttp;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Single-threaded timeout queue. Owned by one {@link ConnectionEventLoop} and only touched from its thread.
 */
class Scheduler {

    private final Clock clock;
    private final PriorityQueue<Task> tasks;
    private long counter;

    Scheduler() {
        this(new SystemClock());
    }

    Scheduler(Clock clock) {
        this.clock = clock;
        this.tasks = new PriorityQueue<>((a, b) -> {
            long difference = a.time - b.time;
            if (difference != 0) {
                return difference < 0 ? -1 : 1;
            }
            return Long.compare(a.id, b.id);
        });
    }

    int size() {
        return tasks.size();
    }

    Cancellable schedule(Runnable runnable, Duration duration) {
        Task task = new Task(runnable, clock.nanoTime() + duration.toNanos(), counter++);
        tasks.add(task);
        return task;
    }

    /**
     * Removes and returns every task whose deadline has passed, earliest first.
     */
    List<Runnable> expired() {
        long time = clock.nanoTime();
        List<Runnable> result = new ArrayList<>();
        while (!tasks.isEmpty() && tasks.peek().time - time <= 0) {
            result.add(tasks.poll().runnable);
        }
        return result;
    }

    private class Task implements Cancellable {
        final Runnable runnable;
        final long time;
        final long id;

        Task(Runnable runnable, long time, long id) {
            this.runnable = runnable;
            this.time = time;
            this.id = id;
        }

        @Override
        public void cancel() {
            tasks.remove(this);
        }
    }

}
