package com.cgi.fielddiscovery.discovery.service;

import com.cgi.fielddiscovery.discovery.model.DiscoveryStats;
import com.cgi.fielddiscovery.discovery.repository.DiscoveredFieldRepository;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Aggregate statistics over discovered fields.
 * Results are cached until the next persistence or review write.
 */
@Service
public class DiscoveryStatsService {
    public static final String STATS_CACHE = "fieldStats";

    static final int RECENT_DAYS = 7;

    private final DiscoveredFieldRepository fieldRepository;

    public DiscoveryStatsService(DiscoveredFieldRepository fieldRepository) {
        this.fieldRepository = fieldRepository;
    }

    @Cacheable(cacheNames = STATS_CACHE, key = "#dataSourceId == null ? 'all' : #dataSourceId")
    public DiscoveryStats getStats(String dataSourceId) {
        return fieldRepository.aggregateStats(dataSourceId, LocalDateTime.now().minusDays(RECENT_DAYS));
    }
}
