/* (C)2026 */
package com.ammann.eegprune.service;

import com.ammann.eegprune.enumeration.EventType;
import com.ammann.eegprune.model.Event;
import java.util.ArrayList;
import java.util.List;

/**
 * Answers "which sleep stage was in effect at this latency" by binary search over the
 * latencies of sleep-stage markers with a parseable code.
 */
final class SleepStageLookup {

    private final int[] latencies;
    private final int[] stages;

    private SleepStageLookup(int[] latencies, int[] stages) {
        this.latencies = latencies;
        this.stages = stages;
    }

    /** @param events events sorted by latency */
    static SleepStageLookup of(List<Event> events) {
        List<Event> markers = new ArrayList<>();
        for (Event event : events) {
            if (event.type() == EventType.SLEEP_STAGE && event.sleepStage() != null) {
                markers.add(event);
            }
        }
        int[] latencies = new int[markers.size()];
        int[] stages = new int[markers.size()];
        for (int i = 0; i < markers.size(); i++) {
            latencies[i] = markers.get(i).latency();
            stages[i] = markers.get(i).sleepStage();
        }
        return new SleepStageLookup(latencies, stages);
    }

    /**
     * @return stage of the last marker at or before {@code latency}, {@code null} when none precedes it
     */
    Integer stageAt(int latency) {
        int low = 0;
        int high = latencies.length - 1;
        int found = -1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (latencies[mid] <= latency) {
                found = mid;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return found < 0 ? null : stages[found];
    }
}
