package com.rideeasy.dispatch.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SystemStatusResponse {
    private int totalDrivers;
    private int availableDrivers;
    private int onTripDrivers;
    private int offlineDrivers;
    private int totalRiders;
    private int totalRides;
    private int activeRides;
    private int activeCarpoolGroups;
    private String matchingPolicy;
    private String farePipeline;
}
