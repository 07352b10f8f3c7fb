package com.gocomet.zonerevenue.zone.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "dim_zones")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Zone {

    @Id
    @Column(name = "locationid")
    private Integer locationId;

    @Column(name = "borough")
    private String borough;

    @Column(name = "zone")
    private String zone;

    @Column(name = "service_zone")
    private String serviceZone;
}
