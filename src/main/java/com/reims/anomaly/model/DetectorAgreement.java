package com.reims.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorAgreement {

    private double agreementPercent;
    private int agreementCount;
    private int totalDetectors;

    @Builder.Default
    private List<DetectorDetail> detectorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DetectorDetail {
        private DetectorKind method;
        private double weight;
        // true when this method flagged the same field (the anomaly or one of its peers)
        private boolean flagged;
    }
}
