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
public class ProgressInfo implements Serializable {
    private static final long serialVersionUID = 1L;

    private int current;
    private int total;
}
