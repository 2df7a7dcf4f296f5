/*
Copyright 2012 Urban Airship and Contributors
*/

package com.urbanairship.flightcube.records;

import com.google.common.collect.ImmutableMap;

/**
 * Fixed lookup from US state name to its two letter postal code. The District of Columbia is
 * included, territories are not.
 */
public final class StateAbbreviations {
    private static final ImmutableMap<String, String> STATE_TO_ABBR = ImmutableMap.<String, String>builder()
            .put("Alabama", "AL").put("Alaska", "AK").put("Arizona", "AZ").put("Arkansas", "AR")
            .put("California", "CA").put("Colorado", "CO").put("Connecticut", "CT").put("Delaware", "DE")
            .put("District of Columbia", "DC").put("Florida", "FL").put("Georgia", "GA").put("Hawaii", "HI")
            .put("Idaho", "ID").put("Illinois", "IL").put("Indiana", "IN").put("Iowa", "IA")
            .put("Kansas", "KS").put("Kentucky", "KY").put("Louisiana", "LA").put("Maine", "ME")
            .put("Maryland", "MD").put("Massachusetts", "MA").put("Michigan", "MI").put("Minnesota", "MN")
            .put("Mississippi", "MS").put("Missouri", "MO").put("Montana", "MT").put("Nebraska", "NE")
            .put("Nevada", "NV").put("New Hampshire", "NH").put("New Jersey", "NJ").put("New Mexico", "NM")
            .put("New York", "NY").put("North Carolina", "NC").put("North Dakota", "ND").put("Ohio", "OH")
            .put("Oklahoma", "OK").put("Oregon", "OR").put("Pennsylvania", "PA").put("Rhode Island", "RI")
            .put("South Carolina", "SC").put("South Dakota", "SD").put("Tennessee", "TN").put("Texas", "TX")
            .put("Utah", "UT").put("Vermont", "VT").put("Virginia", "VA").put("Washington", "WA")
            .put("West Virginia", "WV").put("Wisconsin", "WI").put("Wyoming", "WY")
            .build();

    private StateAbbreviations() {
        //no instances
    }

    /**
     * @return the code for the exact (already trimmed) state name, or null if the name is null or
     * not a known state.
     */
    public static String abbreviate(String stateName) {
        if (stateName == null) {
            return null;
        }
        return STATE_TO_ABBR.get(stateName);
    }
}
