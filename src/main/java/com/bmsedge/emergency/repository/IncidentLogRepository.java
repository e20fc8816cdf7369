package com.bmsedge.emergency.repository;

import com.bmsedge.emergency.model.Incident;
import com.bmsedge.emergency.model.enums.IncidentStatus;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Append-only log of every incident ever created. Entries are the live
 * incident objects, so resolution is visible here as well.
 */
@Repository
public class IncidentLogRepository {

    private final List<Incident> log = new ArrayList<>();

    public void append(Incident incident) {
        log.add(incident);
    }

    public Optional<Incident> findById(String id) {
        return log.stream().filter(i -> i.getId().equals(id)).findFirst();
    }

    // Newest first; ties keep the later insertion first
    public List<Incident> findRecent(Integer limit) {
        List<Incident> newestFirst = new ArrayList<>(log);
        Collections.reverse(newestFirst);
        newestFirst.sort(Comparator.comparing(Incident::getLoggedAt).reversed());
        if (limit != null && limit > 0 && limit < newestFirst.size()) {
            return new ArrayList<>(newestFirst.subList(0, limit));
        }
        return newestFirst;
    }

    public List<Incident> findByStatus(IncidentStatus status) {
        return log.stream().filter(i -> i.getStatus() == status).collect(Collectors.toList());
    }

    public int size() {
        return log.size();
    }
}
