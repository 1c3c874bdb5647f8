package com.phillippitts.voiceorders.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Location of the order snapshot.
 * Binds to properties prefixed with "orders".
 *
 * <p>Accepts Spring resource locations, e.g. {@code classpath:data/store.json} or {@code file:/srv/store.json}.
 *
 * @param snapshotPath snapshot resource location
 */
@ConfigurationProperties(prefix = "orders")
@Validated
public record OrderDataProperties(
        @NotBlank(message = "Order snapshot path must not be blank")
        @DefaultValue("classpath:data/store.json") String snapshotPath
) {
}
