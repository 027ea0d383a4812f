package com.racelisting.common.config;

import com.racelisting.common.catalog.CatalogSource;
import com.racelisting.common.query.MissingFieldPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed binding for listing.* configuration, shared by both listing services.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "listing")
public class ListingProperties {

    @Valid
    private Order order = new Order();

    @Valid
    private Catalog catalog = new Catalog();

    @Valid
    private Seed seed = new Seed();

    @Data
    public static class Order {

        /** Column used when an order request carries no field. */
        @NotBlank(message = "Default order field is required")
        private String defaultField = "advertised_start_time";

        /** What to do with an order request that carries a direction but no field. */
        @NotNull
        private MissingFieldPolicy missingFieldPolicy = MissingFieldPolicy.USE_DEFAULT;
    }

    @Data
    public static class Catalog {

        /** Where the live column names of a listing table are read from. */
        @NotNull
        private CatalogSource source = CatalogSource.PRAGMA;
    }

    @Data
    public static class Seed {

        /** Create the listing table and insert demonstration rows at startup. */
        private boolean enabled = true;

        /** Number of demonstration rows. */
        @Min(0)
        private int rows = 100;
    }
}
