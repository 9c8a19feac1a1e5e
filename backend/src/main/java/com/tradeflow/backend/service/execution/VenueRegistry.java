package com.tradeflow.backend.service.execution;

import com.tradeflow.backend.exception.PermanentVenueException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class VenueRegistry {

    private final Map<String, VenueAdapter> adapters;

    public VenueRegistry(List<VenueAdapter> adapters) {
        this.adapters = adapters.stream()
                .collect(Collectors.toUnmodifiableMap(VenueAdapter::name, Function.identity()));
    }

    public VenueAdapter resolve(String venue) {
        VenueAdapter adapter = adapters.get(venue);
        if (adapter == null) {
            throw new PermanentVenueException(venue, "UNKNOWN_VENUE", "No adapter registered for venue " + venue);
        }
        return adapter;
    }

    public Set<String> names() {
        return adapters.keySet();
    }
}
