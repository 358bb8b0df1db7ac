package com.chessdiagrams;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

/**
 * Client of the chessvision.ai prediction endpoint. The board is posted as a
 * base64 PNG data URL; the reply carries the FEN in {@code result} and the side
 * to move in {@code turn}.
 */
public class ChessvisionRecognitionService implements RecognitionService {

    private static final Logger log = LoggerFactory.getLogger(ChessvisionRecognitionService.class);

    private final HttpClient client;
    private final Gson gson;
    private final String serverUrl;
    private final Duration timeout;

    public ChessvisionRecognitionService(String serverUrl, Duration timeout) {
        this.serverUrl = serverUrl;
        this.timeout = timeout;
        this.gson = new Gson();
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public RecognitionResult recognize(Mat boardImage) throws IOException, InterruptedException {
        MatOfByte mob = new MatOfByte();
        if (!Imgcodecs.imencode(".png", boardImage, mob)) {
            throw new IOException("Cannot encode board image as PNG");
        }
        String body = gson.toJson(buildPayload(mob.toArray()));

        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(serverUrl))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        log.debug("Calling {}", serverUrl);
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new IOException("Recognition service answered HTTP " + resp.statusCode());
        }
        return parseResponse(resp.body());
    }

    static JsonObject buildPayload(byte[] png) {
        JsonObject payload = new JsonObject();
        payload.addProperty("board_orientation", "predict");
        payload.addProperty("cropped", true);
        payload.addProperty("current_player", "white");
        payload.addProperty("image", "data:image/png;base64," + Base64.getEncoder().encodeToString(png));
        payload.addProperty("predict_turn", true);
        return payload;
    }

    static RecognitionResult parseResponse(String body) throws IOException {
        JsonObject result;
        try {
            result = new Gson().fromJson(body, JsonObject.class);
        } catch (JsonParseException e) {
            throw new IOException("Malformed recognition reply: " + e.getMessage(), e);
        }
        if (result == null) {
            throw new IOException("Empty recognition reply");
        }
        String fen = stringOrNull(result.get("result"));
        if (fen == null || fen.isBlank()) {
            throw new IOException("Recognition reply has no position");
        }
        return new RecognitionResult(fen.trim(), Side.parse(stringOrNull(result.get("turn"))));
    }

    private static String stringOrNull(JsonElement element) {
        if (element == null || element.isJsonNull() || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsString();
    }
}
