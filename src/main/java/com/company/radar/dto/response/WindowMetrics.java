package com.company.radar.dto.response;

import com.company.radar.util.MetricUtils;
import com.company.radar.util.WindowAggregate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowMetrics implements Serializable {
    private static final long serialVersionUID = 1L;

    private long clicks;
    private long impressions;
    private double ctr;
    private double avgPosition;
    private int daysWithData;

    public static WindowMetrics from(WindowAggregate aggregate) {
        return WindowMetrics.builder()
                .clicks(aggregate.getClicks())
                .impressions(aggregate.getImpressions())
                .ctr(MetricUtils.round(aggregate.getCtr(), 4))
                .avgPosition(MetricUtils.round(aggregate.getAvgPosition(), 2))
                .daysWithData(aggregate.getDaysWithData())
                .build();
    }
}
