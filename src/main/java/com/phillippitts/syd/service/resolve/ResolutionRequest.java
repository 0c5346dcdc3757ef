package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.service.schema.GlobalDefaults;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Inputs of one resolution: defaults, optional catalog and overrides, and the stars to resolve.
 *
 * <p>Unset optional values fall back to the corresponding default parameter: the catalog to
 * the {@code info} file, the star list file to {@code todo}, the ignore flag to
 * {@code ignore} and the output directory to {@code outdir}.
 */
public final class ResolutionRequest {

    private final GlobalDefaults defaults;
    private final StarCatalog catalog;
    private final OverrideTable overrides;
    private final List<String> stars;
    private final Path starListFile;
    private final Boolean ignoreCatalog;
    private final boolean commandLine;
    private final Path outputDirectory;

    private ResolutionRequest(Builder b) {
        this.defaults = Objects.requireNonNull(b.defaults, "defaults");
        this.catalog = b.catalog;
        this.overrides = b.overrides == null ? OverrideTable.empty() : b.overrides;
        this.stars = b.stars == null ? null : List.copyOf(b.stars);
        this.starListFile = b.starListFile;
        this.ignoreCatalog = b.ignoreCatalog;
        this.commandLine = b.commandLine;
        this.outputDirectory = b.outputDirectory;
    }

    public static Builder builder(GlobalDefaults defaults) {
        return new Builder(defaults);
    }

    public GlobalDefaults defaults() {
        return defaults;
    }

    public StarCatalog catalog() {
        return catalog;
    }

    public OverrideTable overrides() {
        return overrides;
    }

    public List<String> stars() {
        return stars;
    }

    public Path starListFile() {
        return starListFile;
    }

    public Boolean ignoreCatalog() {
        return ignoreCatalog;
    }

    /**
     * Whether per-star overrides apply. Programmatic callers pass stars and leave this false.
     */
    public boolean commandLine() {
        return commandLine;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public static final class Builder {
        private final GlobalDefaults defaults;
        private StarCatalog catalog;
        private OverrideTable overrides;
        private List<String> stars;
        private Path starListFile;
        private Boolean ignoreCatalog;
        private boolean commandLine;
        private Path outputDirectory;

        private Builder(GlobalDefaults defaults) {
            this.defaults = defaults;
        }

        public Builder catalog(StarCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder overrides(OverrideTable overrides) {
            this.overrides = overrides;
            return this;
        }

        public Builder stars(List<String> stars) {
            this.stars = stars;
            return this;
        }

        public Builder starListFile(Path starListFile) {
            this.starListFile = starListFile;
            return this;
        }

        public Builder ignoreCatalog(boolean ignoreCatalog) {
            this.ignoreCatalog = ignoreCatalog;
            return this;
        }

        public Builder commandLine(boolean commandLine) {
            this.commandLine = commandLine;
            return this;
        }

        public Builder outputDirectory(Path outputDirectory) {
            this.outputDirectory = outputDirectory;
            return this;
        }

        public ResolutionRequest build() {
            return new ResolutionRequest(this);
        }
    }
}
