package com.epcid.service;

import com.epcid.domain.RiskTrendPoint;
import com.epcid.dto.RiskDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only risk score history per child, held for the lifetime of the process.
 *
 * Appends for one child are serialized through {@link ConcurrentMap#compute},
 * and each append publishes a fresh immutable list, so readers never see a
 * half-written history and concurrent assessments never lose a point.
 */
@Service
@Slf4j
public class RiskTrendService {

    public static final int DEFAULT_WINDOW = 12;

    private final ConcurrentMap<UUID, List<RiskTrendPoint>> trends = new ConcurrentHashMap<>();

    @Value("${epcid.trend.window:12}")
    private int window = DEFAULT_WINDOW;

    public List<RiskTrendPoint> append(UUID childId, RiskTrendPoint point) {
        if (childId == null || point == null) {
            throw new IllegalArgumentException("childId and point are required");
        }
        List<RiskTrendPoint> updated = trends.compute(childId, (id, current) -> {
            List<RiskTrendPoint> next = new ArrayList<>(current != null ? current.size() + 1 : 1);
            if (current != null) {
                next.addAll(current);
            }
            next.add(point);
            return List.copyOf(next);
        });
        log.debug("Trend point {} appended for child {} ({} points)", point.getScore(), childId, updated.size());
        return updated;
    }

    public List<RiskTrendPoint> history(UUID childId) {
        return trends.getOrDefault(childId, List.of());
    }

    public RiskDTO.Direction direction(UUID childId) {
        return riskDirection(history(childId), window);
    }

    public void clear(UUID childId) {
        trends.remove(childId);
    }

    public static RiskDTO.Direction riskDirection(List<RiskTrendPoint> points) {
        return riskDirection(points, DEFAULT_WINDOW);
    }

    /**
     * Compares the latest point with the mean of the trailing {@code window}
     * points (latest included). Ties are stable.
     */
    public static RiskDTO.Direction riskDirection(List<RiskTrendPoint> points, int window) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be >= 1, got " + window);
        }
        if (points == null || points.size() < 2) {
            return RiskDTO.Direction.STABLE;
        }
        List<RiskTrendPoint> trailing = points.subList(Math.max(0, points.size() - window), points.size());
        double mean = trailing.stream().mapToInt(RiskTrendPoint::getScore).average().orElse(0);
        int last = points.get(points.size() - 1).getScore();
        if (last > mean) {
            return RiskDTO.Direction.RISING;
        }
        if (last < mean) {
            return RiskDTO.Direction.FALLING;
        }
        return RiskDTO.Direction.STABLE;
    }
}
