package com.spotifydump;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spotifydump.spotify.FetchException;
import com.spotifydump.spotify.ForbiddenException;
import com.spotifydump.spotify.SpotifyLibraryClient;
import com.spotifydump.spotify.UnauthorizedException;
import com.spotifydump.spotify.model.LibrarySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Command-line entry point: {@code spotify-dump [access-token]}.
 * Prints the library snapshot as JSON on stdout; progress and errors go to stderr.
 */
public class Main {

    static final int EXIT_OK = 0;
    static final int EXIT_NO_TOKEN = 1;
    static final int EXIT_UNAUTHORIZED = 2;
    static final int EXIT_FORBIDDEN = 3;
    static final int EXIT_FAILED = 4;

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        int code = run(args, System.out, System.err, SpotifyLibraryClient::fromConfig, Instant::now);
        System.exit(code);
    }

    static int run(String[] args, PrintStream out, PrintStream err,
                   Supplier<SpotifyLibraryClient> clientFactory, Supplier<Instant> clock) {
        String token = (args != null && args.length > 0 && !args[0].isBlank()) ? args[0].trim() : Config.getAccessToken();
        if (token == null || token.isBlank()) {
            err.println("Error: pass an access token as the first argument or set SPOTIFY_ACCESS_TOKEN.");
            return EXIT_NO_TOKEN;
        }

        LibrarySnapshot snapshot;
        try {
            snapshot = clientFactory.get().exportLibrary(token);
        } catch (UnauthorizedException e) {
            err.println("Error: Access token expired or invalid. Re-authenticate and try again.");
            return EXIT_UNAUTHORIZED;
        } catch (ForbiddenException e) {
            err.println("Error: User not registered in Spotify Developer Dashboard. Add the account as a tester for this app.");
            return EXIT_FORBIDDEN;
        } catch (FetchException e) {
            log.debug("Export failed ({})", e.getKind(), e);
            String status = e.getStatusCode().isPresent() ? " (HTTP " + e.getStatusCode().getAsInt() + ")" : "";
            err.println("Error: export failed" + status + ": " + e.getMessage());
            return EXIT_FAILED;
        }

        err.println("Fetched " + snapshot.savedTracks().size() + " saved tracks, "
                + snapshot.playlists().size() + " playlists, "
                + snapshot.albums().size() + " albums, "
                + snapshot.artists().size() + " artists.");

        try {
            out.println(toJson(snapshot, clock.get()));
        } catch (IOException e) {
            log.error("Could not serialize snapshot", e);
            err.println("Error: could not write snapshot: " + e.getMessage());
            return EXIT_FAILED;
        }
        return EXIT_OK;
    }

    /**
     * Snapshot JSON with the caller-assigned export timestamp in front.
     */
    static String toJson(LibrarySnapshot snapshot, Instant exportedAt) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        ObjectNode root = mapper.createObjectNode();
        root.put("exported_at", exportedAt.toString());
        root.setAll((ObjectNode) mapper.valueToTree(snapshot));
        return mapper.writeValueAsString(root);
    }
}
