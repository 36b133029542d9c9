package com.purchasingpower.chatgateway.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ProvidersProperties providers = new ProvidersProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private FallbackProperties fallback = new FallbackProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ModerationProperties moderation = new ModerationProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ContextProperties context = new ContextProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private AnalyticsProperties analytics = new AnalyticsProperties();
}
