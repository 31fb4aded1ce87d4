package com.scholary.meeting.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.HttpWaitStrategy;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/** Runs the client against a MinIO container; skipped when Docker is unavailable. */
@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStoreClientTest {

  private static final String ACCESS_KEY = "minioadmin";
  private static final String SECRET_KEY = "minioadmin";
  private static final String BUCKET = "meetings";

  @Container
  static GenericContainer<?> minio =
      new GenericContainer<>("minio/minio:latest")
          .withExposedPorts(9000)
          .withEnv("MINIO_ROOT_USER", ACCESS_KEY)
          .withEnv("MINIO_ROOT_PASSWORD", SECRET_KEY)
          .withCommand("server /data")
          .waitingFor(new HttpWaitStrategy().forPath("/minio/health/ready").forPort(9000));

  private static S3ObjectStoreClient client;

  @BeforeAll
  static void setUp() {
    String endpoint = String.format("http://%s:%d", minio.getHost(), minio.getMappedPort(9000));
    client =
        new S3ObjectStoreClient(
            new ObjectStoreProperties(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET, "us-east-1", true));
    MinioBuckets.create(endpoint, ACCESS_KEY, SECRET_KEY, BUCKET);
  }

  @AfterAll
  static void tearDown() {
    client.close();
  }

  @Test
  void putObject_shouldStoreReadableObject() throws Exception {
    byte[] bytes = "Alice: hello\n".getBytes(StandardCharsets.UTF_8);

    client.putObject(
        BUCKET, "in/hello.txt", new ByteArrayInputStream(bytes), bytes.length, "text/plain");

    try (InputStream stream = client.getObjectStream(BUCKET, "in/hello.txt")) {
      assertThat(new String(stream.readAllBytes(), StandardCharsets.UTF_8))
          .isEqualTo("Alice: hello\n");
    }
  }

  @Test
  void getObjectStream_shouldThrowExceptionForNonExistentObject() {
    assertThatThrownBy(() -> client.getObjectStream(BUCKET, "in/missing.txt"))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("in/missing.txt");
  }

  @Test
  void presignGet_shouldGrantTemporaryAccess() throws Exception {
    byte[] bytes = "{\"turns\":[]}".getBytes(StandardCharsets.UTF_8);
    client.putObject(
        BUCKET,
        "meetings/m1/01_turns.json",
        new ByteArrayInputStream(bytes),
        bytes.length,
        "application/json");

    URL url = client.presignGet(BUCKET, "meetings/m1/01_turns.json", Duration.ofMinutes(5));

    assertThat(url.getPath()).isEqualTo("/meetings/meetings/m1/01_turns.json");
    HttpResponse<String> response =
        HttpClient.newHttpClient()
            .send(
                HttpRequest.newBuilder(URI.create(url.toString())).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("{\"turns\":[]}");
  }
}
