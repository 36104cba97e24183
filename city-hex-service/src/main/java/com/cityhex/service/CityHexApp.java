package com.cityhex.service;

import com.cityhex.common.config.IndexSettings;
import com.cityhex.service.loader.LoadReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 *   load                     index the configured dataset
 *   reload                   truncate, then load
 *   cell &lt;address&gt;           cities under one cell
 *   polygon &lt;request.json&gt;   cities inside a polygon query body
 *
 *   --in-memory   use a heap table and load before querying
 *   --sample      use the bundled sample dataset
 * </pre>
 */
public class CityHexApp {
    private static final Logger log = LoggerFactory.getLogger(CityHexApp.class);

    static final String SAMPLE_DATASET = "sample_cities.geojson";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        var positional = new ArrayList<String>();
        boolean inMemory = false;
        boolean sample = false;
        for (String arg : args) {
            switch (arg) {
                case "--in-memory" -> inMemory = true;
                case "--sample" -> sample = true;
                default -> positional.add(arg);
            }
        }
        if (positional.isEmpty()) {
            usage();
            return 2;
        }

        IndexSettings settings = IndexSettings.load();
        if (sample) {
            settings = settings.withDatasetPath(SAMPLE_DATASET);
        }
        log.info("Starting city hex index ({} store)", inMemory ? "in-memory" : settings.storePath());

        try (CityIndex index = inMemory ? CityIndex.inMemory(settings) : CityIndex.open(settings)) {
            var handlers = new CityIndexHandlers(index);
            if (inMemory && isQuery(positional.get(0))) {
                handlers.loadCities();
            }
            return dispatch(handlers, positional);
        } catch (RuntimeException e) {
            log.error("Command {} failed", positional, e);
            return 1;
        }
    }

    private static int dispatch(CityIndexHandlers handlers, List<String> command) {
        switch (command.get(0)) {
            case "load" -> {
                return report(handlers.loadCities());
            }
            case "reload" -> {
                return report(handlers.reloadCities());
            }
            case "cell" -> {
                if (command.size() != 2) break;
                return print(handlers.queryCell(command.get(1)));
            }
            case "polygon" -> {
                if (command.size() != 2) break;
                String body;
                try {
                    body = Files.readString(Path.of(command.get(1)));
                } catch (IOException e) {
                    log.error("Cannot read request file {}", command.get(1), e);
                    return 2;
                }
                String json = handlers.queryPolygonJson(body);
                System.out.println(json);
                return json.startsWith("{\"statusCode\":200") ? 0 : 1;
            }
            default -> log.error("Unknown command {}", command.get(0));
        }
        usage();
        return 2;
    }

    private static boolean isQuery(String command) {
        return command.equals("cell") || command.equals("polygon");
    }

    private static int report(LoadReport report) {
        System.out.println(report);
        return report.complete() ? 0 : 1;
    }

    private static int print(QueryResponse response) {
        System.out.println(CityIndexHandlers.toJson(response));
        return response.statusCode() == 200 ? 0 : 1;
    }

    private static void usage() {
        System.err.println("usage: city-hex [--in-memory] [--sample] load | reload | cell <address> | polygon <request.json>");
    }
}
