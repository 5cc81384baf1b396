package com.rideeasy.dispatch.controller;

import com.rideeasy.dispatch.model.RideRequest;
import com.rideeasy.dispatch.model.RideResponse;
import com.rideeasy.dispatch.model.RideStatusUpdateRequest;
import com.rideeasy.dispatch.service.DispatchCoordinator;
import com.rideeasy.shared.dto.ApiResponse;
import com.rideeasy.shared.exception.DispatchException;
import com.rideeasy.shared.model.Location;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rides")
@RequiredArgsConstructor
public class DispatchController {

    private final DispatchCoordinator coordinator;

    @PostMapping
    public ResponseEntity<ApiResponse<RideResponse>> requestRide(@Valid @RequestBody RideRequest request) {
        Location pickup = Location.of(request.getPickupLat(), request.getPickupLng(), request.getPickupAddress());
        Location dropoff = Location.of(request.getDropoffLat(), request.getDropoffLng(), request.getDropoffAddress());

        String rideId = coordinator.requestRide(request.getRiderId(), pickup, dropoff,
                request.getMode(), request.getVehicleClass());
        RideResponse response = coordinator.getRide(rideId)
                .orElseThrow(() -> DispatchException.notFound("Ride " + rideId + " not found"));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(response));
    }

    @GetMapping("/{rideId}")
    public ResponseEntity<ApiResponse<RideResponse>> getRide(@PathVariable("rideId") String rideId) {
        RideResponse response = coordinator.getRide(rideId)
                .orElseThrow(() -> DispatchException.notFound("Ride " + rideId + " not found"));
        return ResponseEntity.ok(ApiResponse.ok(response));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<RideResponse>>> getRidesForRider(@RequestParam("riderId") String riderId) {
        return ResponseEntity.ok(ApiResponse.ok(coordinator.getRidesForRider(riderId)));
    }

    @PutMapping("/{rideId}/status")
    public ResponseEntity<ApiResponse<RideResponse>> updateStatus(
            @PathVariable("rideId") String rideId,
            @Valid @RequestBody RideStatusUpdateRequest request) {

        return ResponseEntity.ok(ApiResponse.ok(coordinator.updateRideStatus(rideId, request.getStatus())));
    }
}
