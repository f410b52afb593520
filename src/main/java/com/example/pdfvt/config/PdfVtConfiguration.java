package com.example.pdfvt.config;

import com.example.pdfvt.domain.model.VersionProfileRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-wide beans that are not discovered by component scanning.
 */
@Configuration
public class PdfVtConfiguration {

	/**
	 * The single profile registry shared by the metadata writer and the compliance checker.
	 *
	 * @return registry containing the VT-1 and VT-3 profiles
	 */
    @Bean
    VersionProfileRegistry versionProfileRegistry() {
        return VersionProfileRegistry.standard();
    }
}
