package com.rideeasy.dispatch.entity;

import com.rideeasy.shared.model.Location;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(of = "id")
public class Rider {

    private String id;
    private String name;
    private String phone;
    private Location defaultPickupLocation;

    @Builder.Default
    private double rating = 5.0;
}
