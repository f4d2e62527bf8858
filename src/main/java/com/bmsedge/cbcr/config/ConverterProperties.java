package com.bmsedge.cbcr.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Converter settings, bound once at startup from {@code cbcr.converter.*}
 * and read-only afterwards.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "cbcr.converter")
public class ConverterProperties {

    @NotNull
    private final DataSize maxFileSize;

    @NotEmpty
    private final List<String> allowedExtensions;

    @NotBlank
    private final String identifierScheme;

    @NotBlank
    private final String taxonomyEntryPoint;

    public ConverterProperties(@DefaultValue("16MB") DataSize maxFileSize,
                               @DefaultValue({"xlsx", "xls"}) List<String> allowedExtensions,
                               @DefaultValue("http://www.company-registry.eu") String identifierScheme,
                               @DefaultValue("http://xbrl.ifrs.org/taxonomy/2024-03-14/ifrs-cbcr.xsd") String taxonomyEntryPoint) {
        this.maxFileSize = maxFileSize;
        this.allowedExtensions = allowedExtensions.stream()
                .map(ext -> ext.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
        this.identifierScheme = identifierScheme;
        this.taxonomyEntryPoint = taxonomyEntryPoint;
    }

    public static ConverterProperties defaults() {
        return new ConverterProperties(
                DataSize.ofMegabytes(16),
                List.of("xlsx", "xls"),
                "http://www.company-registry.eu",
                "http://xbrl.ifrs.org/taxonomy/2024-03-14/ifrs-cbcr.xsd"
        );
    }

    public boolean isAllowedFileName(String fileName) {
        if (fileName == null) return false;
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return false;
        return allowedExtensions.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
