package com.rideeasy.dispatch.controller;

import com.rideeasy.dispatch.model.RideResponse;
import com.rideeasy.dispatch.service.DispatchCoordinator;
import com.rideeasy.shared.enums.RideMode;
import com.rideeasy.shared.enums.RideStatus;
import com.rideeasy.shared.enums.VehicleClass;
import com.rideeasy.shared.exception.DispatchException;
import com.rideeasy.shared.model.Location;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DispatchController.class)
class DispatchControllerTest {

    private static final String RIDE_JSON = """
            {
              "riderId": "R1",
              "pickupLat": 12.90, "pickupLng": 77.60, "pickupAddress": "MG Road",
              "dropoffLat": 13.00, "dropoffLng": 77.60, "dropoffAddress": "Indiranagar",
              "vehicleClass": "%s",
              "mode": "SOLO"
            }
            """;

    @Autowired private MockMvc mockMvc;
    @MockBean private DispatchCoordinator coordinator;

    @Test
    @DisplayName("POST /rides returns 201 with the ride snapshot")
    void requestRide() throws Exception {
        when(coordinator.requestRide(eq("R1"), any(Location.class), any(Location.class),
                eq(RideMode.SOLO), eq(VehicleClass.SEDAN))).thenReturn("RIDE_1");
        when(coordinator.getRide("RIDE_1")).thenReturn(Optional.of(assignedRide()));

        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RIDE_JSON.formatted("SEDAN")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.rideId").value("RIDE_1"))
                .andExpect(jsonPath("$.data.driverId").value("D1"))
                .andExpect(jsonPath("$.data.status").value("DRIVER_ASSIGNED"));
    }

    @Test
    @DisplayName("Vehicle class binds from its display name")
    void vehicleClassByDisplayName() throws Exception {
        when(coordinator.requestRide(any(), any(), any(), any(), eq(VehicleClass.AUTO_RICKSHAW))).thenReturn("RIDE_2");
        when(coordinator.getRide("RIDE_2")).thenReturn(Optional.of(RideResponse.builder().rideId("RIDE_2").build()));

        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RIDE_JSON.formatted("Auto-Rickshaw")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.rideId").value("RIDE_2"));
    }

    @Test
    @DisplayName("Missing fields fail validation with 400 before reaching the coordinator")
    void validationFailure() throws Exception {
        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pickupLat\": 12.9}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("VALIDATION_ERROR"));

        verifyNoInteractions(coordinator);
    }

    @Test
    @DisplayName("Malformed JSON and unknown vehicle classes are 400 and never reach the coordinator")
    void malformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{ not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("MALFORMED_REQUEST"));

        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RIDE_JSON.formatted("Helicopter")))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(coordinator);
    }

    @Test
    @DisplayName("Unknown rider maps to 404")
    void unknownRider() throws Exception {
        when(coordinator.requestRide(any(), any(), any(), any(), any()))
                .thenThrow(DispatchException.notFound("Rider R1 not found"));

        mockMvc.perform(post("/api/v1/rides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(RIDE_JSON.formatted("SEDAN")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("Rider R1 not found"));
    }

    @Test
    @DisplayName("GET /rides/{id} returns the ride or 404")
    void getRide() throws Exception {
        when(coordinator.getRide("RIDE_1")).thenReturn(Optional.of(assignedRide()));
        when(coordinator.getRide("RIDE_9")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/rides/RIDE_1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pickup.address").value("MG Road"));

        mockMvc.perform(get("/api/v1/rides/RIDE_9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("GET /rides?riderId= lists that rider's rides")
    void ridesForRider() throws Exception {
        when(coordinator.getRidesForRider("R1")).thenReturn(List.of(assignedRide()));

        mockMvc.perform(get("/api/v1/rides").param("riderId", "R1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].rideId").value("RIDE_1"));
    }

    @Test
    @DisplayName("PUT /rides/{id}/status applies the transition")
    void updateStatus() throws Exception {
        RideResponse completed = RideResponse.builder()
                .rideId("RIDE_1")
                .status(RideStatus.COMPLETED)
                .distance(11.1)
                .fare(new BigDecimal("151.00"))
                .build();
        when(coordinator.updateRideStatus("RIDE_1", RideStatus.COMPLETED)).thenReturn(completed);

        mockMvc.perform(put("/api/v1/rides/RIDE_1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"COMPLETED\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fare").value(151.00));

        verify(coordinator).updateRideStatus("RIDE_1", RideStatus.COMPLETED);
    }

    @Test
    @DisplayName("Illegal transition maps to 400 INVALID_INPUT")
    void illegalTransition() throws Exception {
        when(coordinator.updateRideStatus("RIDE_1", RideStatus.REQUESTED))
                .thenThrow(DispatchException.invalidInput("Cannot move ride RIDE_1 from IN_PROGRESS to REQUESTED"));

        mockMvc.perform(put("/api/v1/rides/RIDE_1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\": \"REQUESTED\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_INPUT"));
    }

    private static RideResponse assignedRide() {
        return RideResponse.builder()
                .rideId("RIDE_1")
                .riderId("R1")
                .driverId("D1")
                .driverName("Ravi")
                .status(RideStatus.DRIVER_ASSIGNED)
                .mode(RideMode.SOLO)
                .vehicleClass(VehicleClass.SEDAN)
                .pickup(Location.of(12.90, 77.60, "MG Road"))
                .dropoff(Location.of(13.00, 77.60, "Indiranagar"))
                .requestedAt(Instant.parse("2026-03-01T09:30:00Z"))
                .build();
    }
}
