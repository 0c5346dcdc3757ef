package com.phillippitts.syd.service.resolve;

import com.phillippitts.syd.config.properties.SydProperties;
import com.phillippitts.syd.domain.EchelleMask;
import com.phillippitts.syd.domain.EchelleOrders;
import com.phillippitts.syd.domain.StarConfiguration;
import com.phillippitts.syd.exception.ConfigurationException;
import com.phillippitts.syd.service.constants.ScalingRelations;
import com.phillippitts.syd.service.schema.GlobalDefaults;
import com.phillippitts.syd.service.schema.ParameterCatalog;
import com.phillippitts.syd.service.schema.ParameterDefinition;
import com.phillippitts.syd.service.schema.ParameterNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Produces one {@link StarConfiguration} per requested star.
 *
 * <p>Precedence, lowest to highest: global defaults, the star's catalog row, per-star
 * overrides (only for command-line requests). Derived values are computed last:
 * <ul>
 *   <li>a known numax disables the search stage, keeps a supplied dnu as the forced value
 *       and sets dnu from the empirical numax relation;</li>
 *   <li>otherwise radius and logg give the mass, and with teff also numax and dnu;</li>
 *   <li>the echelle mask is set when both bounds are known.</li>
 * </ul>
 *
 * <p>All stars are resolved before anything touches the filesystem, so a
 * {@link ConfigurationException} leaves no output directories behind. Apart from creating
 * {@code <outdir>/<star>} when {@code save} is on, resolution has no side effects.
 */
@Component
public class ParameterResolver {

    private static final Logger LOG = LogManager.getLogger(ParameterResolver.class);

    private final ResolutionValidator validator;

    @Autowired
    public ParameterResolver(SydProperties properties) {
        this(properties.getResolution().getMaxLaws());
    }

    public ParameterResolver(int maxLaws) {
        this.validator = new ResolutionValidator(maxLaws);
    }

    /**
     * Resolves every requested star.
     *
     * @throws ConfigurationException if no stars are available, an override sequence has the
     *         wrong length, a value has the wrong type or a catalog cell cannot be cast
     */
    public ResolvedStars resolve(ResolutionRequest request) {
        GlobalDefaults defaults = request.defaults();
        List<String> stars = determineStars(request);
        validator.validate(defaults, request.overrides(), stars.size());

        Path outdir = request.outputDirectory() != null
                ? request.outputDirectory()
                : Path.of(defaults.getString(ParameterNames.OUTDIR));
        boolean ignore = request.ignoreCatalog() != null
                ? request.ignoreCatalog()
                : defaults.isEnabled(ParameterNames.IGNORE);
        StarCatalog catalog = ignore ? null : locateCatalog(request);
        boolean applyOverrides = request.commandLine() && !request.overrides().isEmpty();

        Map<String, StarConfiguration> resolved = new LinkedHashMap<>();
        for (int i = 0; i < stars.size(); i++) {
            String star = stars.get(i).trim();
            Map<String, Object> values = seed(defaults, outdir);
            if (catalog != null) {
                catalog.find(StarIds.normalize(star))
                        .ifPresent(entry -> applyCatalog(defaults.catalog(), entry, values));
            }
            if (applyOverrides) {
                for (String name : request.overrides().names()) {
                    values.put(name, request.overrides().valueAt(name, i));
                }
            }
            validator.validateOversampling(values.get(ParameterNames.OVERSAMPLING_FACTOR));
            validator.validateLaws(values.get(ParameterNames.N_LAWS));
            EchelleOrders.parse(asText(values.get(ParameterNames.NOY)));

            EchelleMask mask = derive(values);
            if (resolved.put(star, new StarConfiguration(star, outdir.resolve(star), values, mask)) != null) {
                LOG.warn("Star {} requested more than once, keeping the last occurrence", star);
            }
        }

        createDirectories(resolved);
        LOG.info("Resolved {} star(s) into {} (catalog: {}, overrides: {})", resolved.size(), outdir,
                catalog != null, applyOverrides);
        return new ResolvedStars(resolved);
    }

    private List<String> determineStars(ResolutionRequest request) {
        List<String> stars = request.stars();
        if (stars == null || stars.isEmpty()) {
            Path listFile = request.starListFile();
            if (listFile == null) {
                String todo = request.defaults().getString(ParameterNames.TODO);
                listFile = todo == null ? null : Path.of(todo);
            }
            stars = StarListReader.read(listFile);
        }
        if (stars.isEmpty()) {
            throw new ConfigurationException("No stars or star list provided", ParameterNames.TODO);
        }
        return stars;
    }

    private StarCatalog locateCatalog(ResolutionRequest request) {
        if (request.catalog() != null) {
            return request.catalog();
        }
        String info = request.defaults().getString(ParameterNames.INFO);
        if (info != null && Files.isRegularFile(Path.of(info))) {
            return CsvStarCatalog.load(Path.of(info));
        }
        LOG.debug("No star catalog at {}, using defaults only", info);
        return null;
    }

    private static Map<String, Object> seed(GlobalDefaults defaults, Path outdir) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (ParameterDefinition d : defaults.catalog().definitions()) {
            values.put(d.name(), d.type().normalize(defaults.values().get(d.name())));
        }
        values.put(ParameterNames.OUTDIR, outdir.toString());
        values.put(ParameterNames.FORCE, null);
        values.put(ParameterNames.MASS, null);
        return values;
    }

    private static void applyCatalog(ParameterCatalog catalog, CatalogEntry entry, Map<String, Object> values) {
        for (String column : entry.cells().keySet()) {
            Optional<ParameterDefinition> definition = catalog.find(column);
            Optional<String> cell = entry.cell(column);
            if (definition.isEmpty() || cell.isEmpty()) {
                continue;
            }
            ParameterDefinition d = definition.get();
            try {
                values.put(column, d.type().parse(cell.get()));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Catalog value '" + cell.get() + "' for star "
                        + entry.star() + " is not of type " + d.type(), column, e);
            }
        }
    }

    private static EchelleMask derive(Map<String, Object> values) {
        Double numax = asDouble(values.get(ParameterNames.NUMAX));
        if (numax != null) {
            values.put(ParameterNames.ESTIMATE, false);
            Double dnu = asDouble(values.get(ParameterNames.DNU));
            if (dnu != null) {
                values.put(ParameterNames.FORCE, dnu);
            }
            values.put(ParameterNames.DNU, ScalingRelations.deltaNu(numax));
        } else {
            Double radius = asDouble(values.get(ParameterNames.RADIUS));
            Double logg = asDouble(values.get(ParameterNames.LOGG));
            if (radius != null && logg != null) {
                double mass = ScalingRelations.mass(radius, logg);
                values.put(ParameterNames.MASS, mass);
                Double teff = asDouble(values.get(ParameterNames.TEFF));
                if (teff != null) {
                    values.put(ParameterNames.NUMAX, ScalingRelations.numax(mass, radius, teff));
                    values.put(ParameterNames.DNU, ScalingRelations.deltaNu(mass, radius));
                }
            }
        }
        Double lower = asDouble(values.get(ParameterNames.LOWER_ECH));
        Double upper = asDouble(values.get(ParameterNames.UPPER_ECH));
        return lower != null && upper != null ? new EchelleMask(lower, upper) : null;
    }

    private void createDirectories(Map<String, StarConfiguration> resolved) {
        for (StarConfiguration config : resolved.values()) {
            if (!config.getBoolean(ParameterNames.SAVE)) {
                continue;
            }
            try {
                Files.createDirectories(config.path());
            } catch (IOException e) {
                throw new ConfigurationException("Cannot create output directory " + config.path(),
                        ParameterNames.OUTDIR, e);
            }
        }
    }

    private static Double asDouble(Object value) {
        return value instanceof Number n ? n.doubleValue() : null;
    }

    private static String asText(Object value) {
        return value == null ? null : value.toString();
    }
}
