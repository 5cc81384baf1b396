package com.rideeasy.dispatch.controller;

import com.rideeasy.dispatch.entity.Driver;
import com.rideeasy.dispatch.entity.Rider;
import com.rideeasy.dispatch.entity.Vehicle;
import com.rideeasy.dispatch.model.DriverRegistrationRequest;
import com.rideeasy.dispatch.model.DriverResponse;
import com.rideeasy.dispatch.model.LocationUpdateRequest;
import com.rideeasy.dispatch.model.RiderRegistrationRequest;
import com.rideeasy.dispatch.model.SystemStatusResponse;
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

/**
 * Rider and driver registration, driver-side updates and the system snapshot.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RegistryController {

    private final DispatchCoordinator coordinator;

    @PostMapping("/riders")
    public ResponseEntity<ApiResponse<String>> registerRider(@Valid @RequestBody RiderRegistrationRequest request) {
        Location defaultPickup = request.getDefaultLat() != null && request.getDefaultLng() != null
                ? Location.of(request.getDefaultLat(), request.getDefaultLng(), request.getDefaultAddress())
                : null;

        coordinator.registerRider(Rider.builder()
                .id(request.getRiderId())
                .name(request.getName())
                .phone(request.getPhone())
                .defaultPickupLocation(defaultPickup)
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(request.getRiderId()));
    }

    @PostMapping("/drivers")
    public ResponseEntity<ApiResponse<String>> registerDriver(@Valid @RequestBody DriverRegistrationRequest request) {
        Vehicle vehicle = Vehicle.builder()
                .vehicleId(request.getVehicleId())
                .model(request.getModel())
                .licensePlate(request.getLicensePlate())
                .vehicleClass(request.getVehicleClass())
                .capacity(request.getCapacity())
                .build();

        coordinator.registerDriver(Driver.builder()
                .id(request.getDriverId())
                .name(request.getName())
                .phone(request.getPhone())
                .vehicle(vehicle)
                .currentLocation(Location.of(request.getLatitude(), request.getLongitude(), request.getAddress()))
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(request.getDriverId()));
    }

    @GetMapping("/drivers")
    public ResponseEntity<ApiResponse<List<DriverResponse>>> getAvailableDrivers() {
        return ResponseEntity.ok(ApiResponse.ok(coordinator.getAvailableDrivers()));
    }

    @GetMapping("/drivers/{driverId}")
    public ResponseEntity<ApiResponse<DriverResponse>> getDriver(@PathVariable("driverId") String driverId) {
        return coordinator.getDriver(driverId)
                .map(driver -> ResponseEntity.ok(ApiResponse.ok(driver)))
                .orElseThrow(() -> DispatchException.notFound("Driver " + driverId + " not found"));
    }

    @PutMapping("/drivers/{driverId}/location")
    public ResponseEntity<ApiResponse<Void>> updateLocation(
            @PathVariable("driverId") String driverId,
            @Valid @RequestBody LocationUpdateRequest request) {

        coordinator.updateDriverLocation(driverId,
                Location.of(request.getLatitude(), request.getLongitude(), request.getAddress()));
        return ResponseEntity.ok(ApiResponse.ok(null));
    }

    @PutMapping("/drivers/{driverId}/availability")
    public ResponseEntity<ApiResponse<DriverResponse>> setAvailability(
            @PathVariable("driverId") String driverId,
            @RequestParam("online") boolean online) {

        return ResponseEntity.ok(ApiResponse.ok(coordinator.setDriverOnline(driverId, online)));
    }

    @GetMapping("/system/status")
    public ResponseEntity<ApiResponse<SystemStatusResponse>> getSystemStatus() {
        return ResponseEntity.ok(ApiResponse.ok(coordinator.getSystemStatus()));
    }
}
