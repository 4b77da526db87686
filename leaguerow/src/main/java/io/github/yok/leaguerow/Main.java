package io.github.yok.leaguerow;

import io.github.yok.leaguerow.config.LeagueRowConfig;
import io.github.yok.leaguerow.core.InvalidRowException;
import io.github.yok.leaguerow.core.RowJsonMapper;
import io.github.yok.leaguerow.core.RowParser;
import io.github.yok.leaguerow.model.RowParseResult;
import io.github.yok.leaguerow.util.ErrorHandler;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Reads one registration row from a JSON file, parses it with {@link RowParser}, and prints the
 * canonical payload together with the unresolved field keys.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --row <file>} or {@code -r <file>} names the row file, a JSON object of column letter
 * to cell text. Required.</li>
 * <li>{@code --sport <name>} or {@code -s <name>} overrides the sport read from column A.</li>
 * </ul>
 *
 * <p>
 * Output is written to standard output as {@code {"payload": ..., "unresolvedFields": [...]}}.
 * Fatal errors are reported through {@link ErrorHandler}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see LeagueRowConfig
 * @see RowParser
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(LeagueRowConfig.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner {

    private final LeagueRowConfig config;

    /**
     * Bootstraps the application.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        app.run(args);
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        // Parse CLI arguments
        String rowFile = null;
        String sportHint = null;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--row":
                case "-r":
                    rowFile = (i + 1 < args.length ? args[++i] : null);
                    break;
                case "--sport":
                case "-s":
                    sportHint = (i + 1 < args.length ? args[++i] : null);
                    break;
                default:
                    log.warn("Unknown argument: {}", args[i]);
            }
        }

        if (rowFile == null || rowFile.isEmpty()) {
            ErrorHandler.errorAndExit("Row file is required. Use --row <file>.");
            return;
        }

        Path path = Paths.get(rowFile);
        log.info("Row file: {}, Sport hint: {}", path, sportHint);

        RowJsonMapper jsonMapper = new RowJsonMapper();
        Map<String, String> cells;
        try {
            cells = jsonMapper.readCells(path);
        } catch (IOException e) {
            ErrorHandler.errorAndExit("Failed to read row file: " + path, e);
            return;
        }

        try {
            RowParseResult result = new RowParser(config.clock()).parseRow(cells, sportHint);
            System.out.println(jsonMapper.write(result, config.isPrettyPrint()));
            log.info("Row parsed. Unresolved fields: {}", result.getUnresolvedFields());
        } catch (InvalidRowException e) {
            ErrorHandler.errorAndExit("Invalid row: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("Fatal error occurred (row={}): {}", path, e.getMessage(), e);
            ErrorHandler.errorAndExit("Fatal error: " + e.getMessage(), e);
        }
    }
}
