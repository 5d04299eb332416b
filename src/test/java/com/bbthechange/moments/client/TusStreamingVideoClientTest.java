package com.bbthechange.moments.client;

import com.bbthechange.moments.config.StreamingProperties;
import com.bbthechange.moments.exception.StreamingServiceException;
import com.bbthechange.moments.upload.media.InMemoryMediaSource;
import com.bbthechange.moments.upload.media.MediaSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.util.unit.DataSize;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the tus client. The HTTP client is mocked; chunk retry sleeps are recorded
 * instead of slept.
 */
@ExtendWith(MockitoExtension.class)
class TusStreamingVideoClientTest {

    private static final String BASE_URL = "https://stream.test/tus";
    private static final String UPLOAD_URL = "https://stream.test/tus/abc123";

    @Mock
    private HttpClient httpClient;

    private StreamingProperties properties;
    private TusStreamingVideoClient client;
    private final List<Long> sleeps = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new StreamingProperties();
        properties.setEnabled(true);
        properties.setBaseUrl(BASE_URL);
        properties.setApiToken("secret-token");
        properties.setChunkSize(DataSize.ofBytes(4));
        client = new TusStreamingVideoClient(httpClient, properties) {
            @Override
            void sleep(long millis) {
                sleeps.add(millis);
            }
        };
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, Map<String, List<String>> headers) {
        HttpResponse<String> response = mock(HttpResponse.class);
        lenient().when(response.statusCode()).thenReturn(status);
        lenient().when(response.headers()).thenReturn(HttpHeaders.of(headers, (name, value) -> true));
        lenient().when(response.body()).thenReturn("");
        return response;
    }

    private static HttpResponse<String> offset(long offset) {
        return response(204, Map.of("Upload-Offset", List.of(String.valueOf(offset))));
    }

    private List<HttpRequest> sentRequests(int count) throws Exception {
        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient, times(count)).send(captor.capture(), any());
        return captor.getAllValues();
    }

    private static String header(HttpRequest request, String name) {
        return request.headers().firstValue(name).orElse(null);
    }

    @Nested
    @DisplayName("createSession")
    class CreateSessionTests {

        @Test
        @DisplayName("Should create an upload and resolve the returned location")
        void createSession_Success() throws Exception {
            doReturn(response(201, Map.of(
                    "Location", List.of("/tus/abc123"),
                    TusStreamingVideoClient.MEDIA_ID_HEADER, List.of("vid-42"))))
                    .when(httpClient).send(any(HttpRequest.class), any());

            StreamingUploadSession session = client.createSession("clip.mp4", "video/mp4", 10);

            assertThat(session.uploadUrl()).isEqualTo(UPLOAD_URL);
            assertThat(session.videoId()).isEqualTo("vid-42");
            HttpRequest request = sentRequests(1).get(0);
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.uri().toString()).isEqualTo(BASE_URL);
            assertThat(header(request, "Tus-Resumable")).isEqualTo(TusStreamingVideoClient.TUS_VERSION);
            assertThat(header(request, "Upload-Length")).isEqualTo("10");
            assertThat(header(request, "Authorization")).isEqualTo("Bearer secret-token");
            assertThat(header(request, "Upload-Metadata")).isEqualTo(TusStreamingVideoClient.metadata("clip.mp4", "video/mp4"));
        }

        @Test
        @DisplayName("Should report an unavailable session when the service refuses")
        void createSession_ErrorStatus() throws Exception {
            doReturn(response(503, Map.of())).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.createSession("clip.mp4", "video/mp4", 10))
                    .isInstanceOfSatisfying(StreamingServiceException.class,
                            e -> assertThat(e.isSessionUnavailable()).isTrue())
                    .hasMessage("Streaming service returned status 503");
        }

        @Test
        @DisplayName("Should report an unavailable session when no location is returned")
        void createSession_NoLocation() throws Exception {
            doReturn(response(201, Map.of())).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.createSession("clip.mp4", "video/mp4", 10))
                    .isInstanceOfSatisfying(StreamingServiceException.class,
                            e -> assertThat(e.isSessionUnavailable()).isTrue());
        }

        @Test
        @DisplayName("Should report an unavailable session when the service is unreachable")
        void createSession_Unreachable() throws Exception {
            doThrow(new IOException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.createSession("clip.mp4", "video/mp4", 10))
                    .isInstanceOfSatisfying(StreamingServiceException.class,
                            e -> assertThat(e.isSessionUnavailable()).isTrue())
                    .hasCauseInstanceOf(IOException.class);
        }

        @Test
        @DisplayName("Should not call out when streaming is disabled")
        void createSession_Disabled() throws Exception {
            properties.setEnabled(false);

            assertThat(client.isEnabled()).isFalse();
            assertThatThrownBy(() -> client.createSession("clip.mp4", "video/mp4", 10))
                    .isInstanceOf(StreamingServiceException.class);
            verify(httpClient, never()).send(any(HttpRequest.class), any());
        }
    }

    @Nested
    @DisplayName("transfer")
    class TransferTests {

        private final StreamingUploadSession session = new StreamingUploadSession(UPLOAD_URL, "vid-42");
        private final MediaSource clip = new InMemoryMediaSource("clip.mp4", "video/mp4",
                "0123456789".getBytes(StandardCharsets.US_ASCII));
        private final List<Integer> progress = new ArrayList<>();

        @Test
        @DisplayName("Should PATCH the file in chunks and report progress")
        void transfer_AllChunks() throws Exception {
            doReturn(offset(4), offset(8), offset(10)).when(httpClient).send(any(HttpRequest.class), any());

            client.transfer(session, clip, progress::add);

            assertThat(progress).containsExactly(40, 80, 100);
            List<HttpRequest> requests = sentRequests(3);
            assertThat(requests).extracting(HttpRequest::method).containsOnly("PATCH");
            assertThat(requests).extracting(request -> header(request, "Upload-Offset"))
                    .containsExactly("0", "4", "8");
            assertThat(header(requests.get(0), "Content-Type")).isEqualTo("application/offset+octet-stream");
            assertThat(sleeps).isEmpty();
        }

        @Test
        @DisplayName("Should resume from the server's offset after a rejected chunk")
        void transfer_ResumesAfterFailure() throws Exception {
            doReturn(response(500, Map.of()), offset(4), offset(8), offset(10))
                    .when(httpClient).send(any(HttpRequest.class), any());

            client.transfer(session, clip, progress::add);

            List<HttpRequest> requests = sentRequests(4);
            assertThat(requests.stream().map(HttpRequest::method).collect(Collectors.toList()))
                    .containsExactly("PATCH", "HEAD", "PATCH", "PATCH");
            assertThat(header(requests.get(2), "Upload-Offset")).isEqualTo("4");
            assertThat(progress).containsExactly(80, 100);
            assertThat(sleeps).containsExactly(0L);
        }

        @Test
        @DisplayName("Should give up after the chunk retry schedule is exhausted")
        void transfer_RetriesExhausted() throws Exception {
            doReturn(response(500, Map.of())).when(httpClient).send(any(HttpRequest.class), any());

            assertThatThrownBy(() -> client.transfer(session, clip, progress::add))
                    .isInstanceOfSatisfying(StreamingServiceException.class,
                            e -> assertThat(e.getErrorType()).isEqualTo(StreamingServiceException.ErrorType.TRANSFER_FAILED))
                    .hasMessage("Chunked upload of clip.mp4 failed at offset 0");
            assertThat(sleeps).containsExactly(0L, 1000L, 3000L);
            assertThat(progress).isEmpty();
        }
    }

    @Test
    void metadata_Base64EncodesNameAndType() {
        Base64.Encoder encoder = Base64.getEncoder();

        assertThat(TusStreamingVideoClient.metadata("Fête.mov", "video/quicktime")).isEqualTo(
                "name " + encoder.encodeToString("Fête.mov".getBytes(StandardCharsets.UTF_8))
                        + ",filetype " + encoder.encodeToString("video/quicktime".getBytes(StandardCharsets.UTF_8)));
    }
}
