package com.company.radar.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OverviewDeltas implements Serializable {
    private static final long serialVersionUID = 1L;

    private long clicks;
    private long impressions;
    private double clicksPct;
    private double impressionsPct;
    private double ctr;
    private double ctrPct;
    private double avgPosition;
}
