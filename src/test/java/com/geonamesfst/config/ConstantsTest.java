package com.geonamesfst.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class ConstantsTest {

    @Test
    void testQueryDefaults() {
        assertEquals(1, Constants.DEFAULT_MAX_DISTANCE);
        assertEquals(10_000, Constants.DEFAULT_STATE_LIMIT);
        assertEquals("<missing>", Constants.MISSING_VALUE);
    }

    @Test
    void testDefaultLanguagesIncludeEmptyCode() {
        assertTrue(Constants.DEFAULT_ALTERNATE_LANGUAGES.contains(""));
        assertTrue(Constants.DEFAULT_ALTERNATE_LANGUAGES.contains("de"));
        assertTrue(Constants.DEFAULT_ALTERNATE_LANGUAGES.contains("ger"));
        assertEquals(3, Constants.DEFAULT_ALTERNATE_LANGUAGES.size());
    }

    @Test
    void testAdministrativeColumnsFollowCountryCode() {
        assertTrue(Constants.GN_COL_ADMIN_FIRST > Constants.GN_COL_COUNTRY_CODE);
        assertTrue(Constants.GN_COL_ELEVATION > Constants.GN_COL_ADMIN_FIRST + 3);
    }
}
