package com.signalsync.cloud.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ResampleRequest {
    private double[] samples;
    private double origFs;
    private double targetFs;
}
