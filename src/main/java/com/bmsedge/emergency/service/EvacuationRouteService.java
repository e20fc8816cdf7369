package com.bmsedge.emergency.service;

import com.bmsedge.emergency.model.EvacuationRoute;
import com.bmsedge.emergency.model.enums.NotificationType;
import com.bmsedge.emergency.repository.EvacuationRouteRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class EvacuationRouteService {

    // Accessible first, then lit, then fastest
    static final Comparator<EvacuationRoute> RANKING =
            Comparator.comparing((EvacuationRoute r) -> !r.isAccessible())
                    .thenComparing(r -> !r.isLighting())
                    .thenComparingInt(EvacuationRoute::getEstimatedSeconds);

    private final EvacuationRouteRepository routeRepository;
    private final NotificationPublisher notificationPublisher;

    public List<EvacuationRoute> getRoutes() {
        return routeRepository.findAll();
    }

    public boolean exists(String routeId) {
        return routeRepository.findById(routeId).isPresent();
    }

    /**
     * @return empty when the route is unknown or currently blocked
     */
    public Optional<EvacuationRoute> selectPreferred(String routeId) {
        Optional<EvacuationRoute> route = routeRepository.findById(routeId);
        if (route.isEmpty()) {
            log.error("❌ Route not found: {}", routeId);
            return Optional.empty();
        }
        if (!route.get().isClearance()) {
            log.warn("Preferred route {} is blocked", routeId);
            return Optional.empty();
        }
        return route;
    }

    public Optional<EvacuationRoute> recommend() {
        Optional<EvacuationRoute> best = routeRepository.findAll().stream()
                .filter(EvacuationRoute::isClearance)
                .min(RANKING);
        if (best.isEmpty()) {
            log.error("❌ No evacuation routes available!");
        } else {
            log.info("Recommended evacuation: {} ({}s)", best.get().getName(), best.get().getEstimatedSeconds());
        }
        return best;
    }

    public boolean setClearance(String routeId, boolean cleared) {
        Optional<EvacuationRoute> found = routeRepository.findById(routeId);
        if (found.isEmpty()) {
            log.error("❌ Route not found: {}", routeId);
            return false;
        }
        EvacuationRoute route = found.get();
        route.setClearance(cleared);
        log.info("Route {} clearance: {}", route.getName(), cleared ? "CLEAR" : "BLOCKED");

        Map<String, Object> payload = new HashMap<>();
        payload.put("routeId", routeId);
        payload.put("name", route.getName());
        payload.put("clearance", cleared);
        notificationPublisher.publish(NotificationType.ROUTE_UPDATED, payload);
        return true;
    }
}
