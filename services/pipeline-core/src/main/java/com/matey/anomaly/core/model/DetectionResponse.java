package com.matey.anomaly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DetectionResponse {

    private List<AnomalyRecord> anomalies = new ArrayList<>();
}
