package com.company.radar.util;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WindowAggregate implements Serializable {
    private static final long serialVersionUID = 1L;

    private long clicks;
    private long impressions;
    private double ctr;
    private double avgPosition;
    private int daysWithData;

    public static WindowAggregate empty() {
        return new WindowAggregate(0, 0, 0.0, 0.0, 0);
    }
}
