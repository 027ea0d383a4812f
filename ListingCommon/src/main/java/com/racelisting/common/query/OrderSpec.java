package com.racelisting.common.query;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Client supplied sort request. Both parts are optional.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderSpec {

    /** Column to order by; must exist in the table's live column catalog. */
    private String field;

    /** ASC or DESC, case-insensitive; anything else is ignored. */
    private String direction;

    public static OrderSpec of(String field, String direction) {
        return new OrderSpec(field, direction);
    }
}
