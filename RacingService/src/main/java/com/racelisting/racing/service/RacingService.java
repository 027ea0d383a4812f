package com.racelisting.racing.service;

import com.racelisting.common.config.ListingProperties;
import com.racelisting.racing.dto.ListRacesRequest;
import com.racelisting.racing.dto.ListRacesResponse;
import com.racelisting.racing.model.Race;
import com.racelisting.racing.repository.RacesRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class RacingService {

    private final RacesRepository racesRepository;
    private final ListingProperties listingProperties;

    public RacingService(RacesRepository racesRepository, ListingProperties listingProperties) {
        this.racesRepository = racesRepository;
        this.listingProperties = listingProperties;
    }

    @PostConstruct
    public void init() {
        if (listingProperties.getSeed().isEnabled()) {
            racesRepository.init();
        } else {
            log.info("Race seeding disabled");
        }
    }

    /**
     * Lists races matching the optional filter, in the optional order.
     */
    public ListRacesResponse listRaces(ListRacesRequest request) {
        List<Race> races = request == null
                ? racesRepository.list(null, null)
                : racesRepository.list(request.getFilter(), request.getOrder());
        return new ListRacesResponse(races);
    }

    /**
     * @throws com.racelisting.common.exception.ListingNotFoundException when no race has this id
     */
    public Race getRace(long id) {
        return racesRepository.getById(id);
    }
}
