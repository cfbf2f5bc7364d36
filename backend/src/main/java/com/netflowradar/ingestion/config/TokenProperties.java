package com.netflowradar.ingestion.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * The single monitored token contract.
 */
@ConfigurationProperties(prefix = "netflowradar.token")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class TokenProperties {

    @NotBlank
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$", message = "must be a 0x-prefixed 20-byte hex address")
    private String contractAddress;
}
