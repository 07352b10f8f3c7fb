package com.gocomet.zonerevenue.zone.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ZoneResponse {

    private Integer locationId;
    private String borough;
    private String zone;
    private String serviceZone;
}
