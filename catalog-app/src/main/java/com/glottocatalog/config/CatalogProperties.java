package com.glottocatalog.config;

import com.glottocatalog.model.Provider;
import com.glottocatalog.service.ImportMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the reference import. Define them in application.yml under 'catalog'.
 */
@Configuration
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    private Import importSettings = new Import();
    private List<ProviderDefinition> providers = new ArrayList<>();

    public Import getImport() {
        return importSettings;
    }

    public void setImport(Import importSettings) {
        this.importSettings = importSettings;
    }

    public List<ProviderDefinition> getProviders() {
        return providers;
    }

    public void setProviders(List<ProviderDefinition> providers) {
        this.providers = providers;
    }

    public static class Import {
        private ImportMode mode = ImportMode.INSERT;
        private String version = "2.0";
        private String dataDir = "data";
        private int minimumFields = 6;
        private int progressInterval = 1000;
        private boolean linkLanguoids = false;
        private boolean runOnStartup = false;

        /**
         * Directory holding the corpus and change log of the configured version.
         */
        public Path versionDir() {
            return Path.of(dataDir, version);
        }

        public ImportMode getMode() { return mode; }
        public void setMode(ImportMode mode) { this.mode = mode; }

        public String getVersion() { return version; }
        public void setVersion(String version) { this.version = version; }

        public String getDataDir() { return dataDir; }
        public void setDataDir(String dataDir) { this.dataDir = dataDir; }

        public int getMinimumFields() { return minimumFields; }
        public void setMinimumFields(int minimumFields) { this.minimumFields = minimumFields; }

        public int getProgressInterval() { return progressInterval; }
        public void setProgressInterval(int progressInterval) { this.progressInterval = progressInterval; }

        public boolean isLinkLanguoids() { return linkLanguoids; }
        public void setLinkLanguoids(boolean linkLanguoids) { this.linkLanguoids = linkLanguoids; }

        public boolean isRunOnStartup() { return runOnStartup; }
        public void setRunOnStartup(boolean runOnStartup) { this.runOnStartup = runOnStartup; }
    }

    /**
     * Mutable class for Spring Boot configuration binding
     */
    public static class ProviderDefinition {
        private String id;
        private String name;
        private String description;
        private String abbr;
        private String url;

        public Provider toProvider() {
            return new Provider(id, name, description, abbr, url);
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public String getAbbr() { return abbr; }
        public void setAbbr(String abbr) { this.abbr = abbr; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
    }
}
