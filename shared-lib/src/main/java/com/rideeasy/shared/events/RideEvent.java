package com.rideeasy.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rideeasy.shared.enums.RideStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RideEvent {

    private RideEventType type;
    private String message;

    /** Null for registration events. */
    private String rideId;
    private String riderId;
    private String driverId;

    /** Set on RideStatusUpdate only. */
    private RideStatus status;

    /** Set on PaymentCompleted only. */
    private BigDecimal fareAmount;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant occurredAt;

    @JsonIgnore
    public String getEventName() {
        return type != null ? type.getEventName() : null;
    }
}
