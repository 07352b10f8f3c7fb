package com.gocomet.zonerevenue.zone.service;

import com.gocomet.zonerevenue.common.exception.ResourceNotFoundException;
import com.gocomet.zonerevenue.zone.dto.ZoneResponse;
import com.gocomet.zonerevenue.zone.model.Zone;
import com.gocomet.zonerevenue.zone.repository.ZoneRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ZoneService {

    private final ZoneRepository zoneRepository;

    /**
     * List zones, optionally restricted to one borough.
     */
    public List<ZoneResponse> getZones(String borough) {
        List<Zone> zones = borough == null
                ? zoneRepository.findAll(Sort.by("locationId"))
                : zoneRepository.findByBoroughOrderByLocationId(borough);
        return zones.stream().map(this::toResponse).toList();
    }

    public ZoneResponse getZone(Integer locationId) {
        Zone zone = zoneRepository.findById(locationId)
                .orElseThrow(() -> new ResourceNotFoundException("Zone", "locationId", locationId));
        return toResponse(zone);
    }

    private ZoneResponse toResponse(Zone zone) {
        return ZoneResponse.builder()
                .locationId(zone.getLocationId())
                .borough(zone.getBorough())
                .zone(zone.getZone())
                .serviceZone(zone.getServiceZone())
                .build();
    }
}
