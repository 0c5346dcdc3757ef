package com.phillippitts.syd.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for a pipeline run.
 *
 * <p>Paths and run options seed the corresponding parameters; {@code syd.defaults[<name>]}
 * entries replace the declared default of any other parameter, cast per its declared type.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "syd")
public class SydProperties {

    @Valid
    private Paths paths = new Paths();

    @Valid
    private Run run = new Run();

    @Valid
    private Resolution resolution = new Resolution();

    @NotNull
    private Map<String, String> defaults = new LinkedHashMap<>();

    @NotNull
    private List<String> stars = new ArrayList<>();

    public Paths getPaths() {
        return paths;
    }

    public void setPaths(Paths paths) {
        this.paths = paths;
    }

    public Run getRun() {
        return run;
    }

    public void setRun(Run run) {
        this.run = run;
    }

    public Resolution getResolution() {
        return resolution;
    }

    public void setResolution(Resolution resolution) {
        this.resolution = resolution;
    }

    public Map<String, String> getDefaults() {
        return defaults;
    }

    public void setDefaults(Map<String, String> defaults) {
        this.defaults = defaults;
    }

    /**
     * Stars to process. When empty, the star list file ({@code syd.paths.todo}) is read.
     */
    public List<String> getStars() {
        return stars;
    }

    public void setStars(List<String> stars) {
        this.stars = stars;
    }

    /**
     * Input and output locations.
     */
    public static class Paths {
        @NotBlank
        private String outdir = "results";
        @NotBlank
        private String info = "info/star_info.csv";
        @NotBlank
        private String todo = "info/todo.txt";

        public String getOutdir() {
            return outdir;
        }

        public void setOutdir(String outdir) {
            this.outdir = outdir;
        }

        public String getInfo() {
            return info;
        }

        public void setInfo(String info) {
            this.info = info;
        }

        public String getTodo() {
            return todo;
        }

        public void setTodo(String todo) {
            this.todo = todo;
        }
    }

    /**
     * Run mode options.
     */
    public static class Run {
        private boolean parallel = false;
        @Min(0)
        private int threads = 0;
        private boolean overwrite = false;
        private boolean save = true;
        private boolean ignoreCatalog = false;

        public boolean isParallel() {
            return parallel;
        }

        public void setParallel(boolean parallel) {
            this.parallel = parallel;
        }

        /**
         * Worker count in parallel mode; 0 uses every available processor.
         */
        public int getThreads() {
            return threads;
        }

        public void setThreads(int threads) {
            this.threads = threads;
        }

        public boolean isOverwrite() {
            return overwrite;
        }

        public void setOverwrite(boolean overwrite) {
            this.overwrite = overwrite;
        }

        public boolean isSave() {
            return save;
        }

        public void setSave(boolean save) {
            this.save = save;
        }

        public boolean isIgnoreCatalog() {
            return ignoreCatalog;
        }

        public void setIgnoreCatalog(boolean ignoreCatalog) {
            this.ignoreCatalog = ignoreCatalog;
        }
    }

    /**
     * Limits applied while resolving star configurations.
     */
    public static class Resolution {
        @Min(0)
        private int maxLaws = 3;

        /**
         * Largest number of Harvey-like components that may be forced with {@code n_laws}.
         */
        public int getMaxLaws() {
            return maxLaws;
        }

        public void setMaxLaws(int maxLaws) {
            this.maxLaws = maxLaws;
        }
    }
}
