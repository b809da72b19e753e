package com.bbthechange.tvguide.service;

import com.bbthechange.tvguide.dto.SeedResultDTO;

/**
 * One-time population of an empty catalog with the bundled sample channels.
 */
public interface SampleDataService {

    /**
     * Seed the catalog unless it already holds channels, in which case nothing is written.
     * Two concurrent calls against an empty catalog may both insert.
     */
    SeedResultDTO initializeSampleData();
}
