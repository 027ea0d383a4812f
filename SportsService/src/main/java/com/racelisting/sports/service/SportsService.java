package com.racelisting.sports.service;

import com.racelisting.common.config.ListingProperties;
import com.racelisting.sports.dto.ListEventsRequest;
import com.racelisting.sports.dto.ListEventsResponse;
import com.racelisting.sports.model.Event;
import com.racelisting.sports.repository.EventsRepository;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class SportsService {

    private final EventsRepository eventsRepository;
    private final ListingProperties listingProperties;

    public SportsService(EventsRepository eventsRepository, ListingProperties listingProperties) {
        this.eventsRepository = eventsRepository;
        this.listingProperties = listingProperties;
    }

    @PostConstruct
    public void init() {
        if (listingProperties.getSeed().isEnabled()) {
            eventsRepository.init();
        } else {
            log.info("Event seeding disabled");
        }
    }

    public ListEventsResponse listEvents(ListEventsRequest request) {
        List<Event> events = request == null
                ? eventsRepository.list(null, null)
                : eventsRepository.list(request.getFilter(), request.getOrder());
        return new ListEventsResponse(events);
    }

    public Event getEvent(long id) {
        return eventsRepository.getById(id);
    }
}
