package nl.adgroot.scanpdf.ocr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import nl.adgroot.scanpdf.config.ExportConfig;
import nl.adgroot.scanpdf.image.ImageFileFormat;
import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.Dispatcher;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * OCR engine backed by an HTTP service. The image file is posted as the request body;
 * the service answers with
 * <pre>{"width":..,"height":..,"elements":[{"text":..,"x":..,"y":..,"width":..,"height":..,"rtl":false}]}</pre>
 */
public class HttpOcrEngine implements OcrEngine {

  private static final MediaType JPEG = MediaType.parse("image/jpeg");
  private static final MediaType PNG = MediaType.parse("image/png");
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient http;
  private final HttpUrl url;

  public HttpOcrEngine(ExportConfig.OcrConfig cfg) {
    this(new HttpUrl.Builder()
        .scheme("http")
        .host(cfg.host)
        .port(cfg.port)
        .encodedPath(cfg.path.startsWith("/") ? cfg.path : "/" + cfg.path)
        .build(), cfg.timeoutSeconds, cfg.concurrency);
  }

  public HttpOcrEngine(HttpUrl url, int timeoutSeconds, int concurrency) {
    this.url = url;

    Duration t = Duration.ofSeconds(timeoutSeconds);

    Dispatcher dispatcher = new Dispatcher();
    dispatcher.setMaxRequests(Math.max(1, concurrency));
    dispatcher.setMaxRequestsPerHost(Math.max(1, concurrency));

    this.http = new OkHttpClient.Builder()
        .dispatcher(dispatcher)
        .connectTimeout(t)
        .readTimeout(t)
        .writeTimeout(t)
        .callTimeout(t)
        .build();
  }

  @Override
  public String id() {
    return "http-ocr:" + url;
  }

  /** Async API: uses OkHttp enqueue(). */
  @Override
  public CompletableFuture<OcrResult> process(Path imageFile, OcrParams params) {
    HttpUrl.Builder target = url.newBuilder().addQueryParameter("lang", params.languageCode());
    if (params.mode() != null) {
      target.addQueryParameter("mode", params.mode());
    }

    MediaType type = ImageFileFormat.fromFileName(imageFile.getFileName().toString()) == ImageFileFormat.PNG
        ? PNG
        : JPEG;

    Request request = new Request.Builder()
        .url(target.build())
        .post(RequestBody.create(imageFile.toFile(), type))
        .build();

    CompletableFuture<OcrResult> future = new CompletableFuture<>();

    http.newCall(request).enqueue(new Callback() {
      @Override
      public void onFailure(Call call, IOException e) {
        future.completeExceptionally(e);
      }

      @Override
      public void onResponse(Call call, Response resp) {
        try (Response r = resp) {
          if (!r.isSuccessful()) {
            String body = readBodySafely(r.body());
            future.completeExceptionally(
                new IOException("OCR service error: " + r.code() + " " + r.message() + "\n" + body)
            );
            return;
          }

          future.complete(parse(Objects.requireNonNull(r.body()).string()));
        } catch (Exception e) {
          future.completeExceptionally(e);
        }
      }
    });

    return future;
  }

  /** Parses the service response body. */
  public static OcrResult parse(String body) throws IOException {
    JsonNode json = MAPPER.readTree(body);
    if (json == null || !json.isObject()) {
      throw new IOException("OCR response is not a JSON object");
    }

    List<OcrResultElement> elements = new ArrayList<>();
    for (JsonNode e : json.path("elements")) {
      elements.add(new OcrResultElement(
          e.path("text").asText(""),
          new OcrResultElement.Bounds(
              e.path("x").asInt(),
              e.path("y").asInt(),
              e.path("width").asInt(),
              e.path("height").asInt()),
          e.path("rtl").asBoolean(false)));
    }
    return new OcrResult(json.path("width").asInt(), json.path("height").asInt(), elements);
  }

  private static String readBodySafely(ResponseBody body) {
    if (body == null) return "";
    try {
      return body.string();
    } catch (IOException e) {
      return "<unreadable body: " + e.getMessage() + ">";
    }
  }

  public HttpUrl getUrl() {
    return url;
  }
}
