package com.gedcomtree.model;

import java.util.List;

/**
 * Date, place and source pointers of a birth, death, burial or census event.
 */
public record VitalEvent(
    String date,
    String place,
    List<String> sources
) {
    public static final VitalEvent EMPTY = new VitalEvent("", "", List.of());
}
