package me.christianrobert.plpgcheck.core.job.model;

import java.time.LocalDateTime;

/**
 * Progress snapshot of a running job: a percentage, the task at hand and, for batch
 * checks, how many routines were processed so far.
 */
public class JobProgress {
    private int percentage;
    private String currentTask;
    private String details;
    private int processedItems;
    private int totalItems;
    private LocalDateTime lastUpdated;

    public JobProgress() {
        this.percentage = 0;
        this.currentTask = "";
        this.details = "";
        this.lastUpdated = LocalDateTime.now();
    }

    public JobProgress(int percentage, String currentTask) {
        this();
        this.percentage = Math.max(0, Math.min(100, percentage));
        this.currentTask = currentTask != null ? currentTask : "";
    }

    public JobProgress(int percentage, String currentTask, String details) {
        this(percentage, currentTask);
        this.details = details != null ? details : "";
    }

    /**
     * Progress of a batch; the percentage follows from the counts.
     */
    public static JobProgress ofItems(int processedItems, int totalItems, String currentTask) {
        int percentage = totalItems > 0 ? processedItems * 100 / totalItems : 100;
        JobProgress progress = new JobProgress(percentage, currentTask,
                String.format("%d of %d", processedItems, totalItems));
        progress.processedItems = processedItems;
        progress.totalItems = totalItems;
        return progress;
    }

    public int getPercentage() {
        return percentage;
    }

    public String getCurrentTask() {
        return currentTask;
    }

    public String getDetails() {
        return details;
    }

    public int getProcessedItems() {
        return processedItems;
    }

    public int getTotalItems() {
        return totalItems;
    }

    public LocalDateTime getLastUpdated() {
        return lastUpdated;
    }

    @Override
    public String toString() {
        return "JobProgress{" +
                "percentage=" + percentage +
                ", currentTask='" + currentTask + '\'' +
                ", details='" + details + '\'' +
                ", lastUpdated=" + lastUpdated +
                '}';
    }
}
