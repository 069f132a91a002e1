package org.handhistory.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
public class ParseBatchResult {
    private final List<HandSummaryDTO> parsed = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Failure {
        /** position of the hand in the submitted batch */
        private int index;
        private String stage;
        private int fragmentIndex;
        private String error;
    }
}
