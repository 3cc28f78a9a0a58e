package com.megaproject.megaproject.reference;

import java.util.List;

/**
 * External source for reference series observations.
 */
public interface ReferenceDataProvider {

    /**
     * Fetches every available observation of {@code series}. Observations without a value are left out.
     */
    List<ReferenceRecord> fetch(ReferenceSeries series);
}
