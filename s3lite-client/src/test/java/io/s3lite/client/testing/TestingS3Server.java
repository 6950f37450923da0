/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.s3lite.client.testing;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;
import com.google.common.hash.Hashing;
import io.airlift.http.client.HttpStatus;
import io.airlift.http.client.Request;
import io.airlift.http.client.Response;
import io.airlift.http.client.StaticBodyGenerator;
import io.airlift.http.client.testing.TestingHttpClient;
import io.airlift.http.client.testing.TestingResponse;
import io.s3lite.spi.addressing.BucketAddress;

import java.io.ByteArrayOutputStream;
import java.net.URLDecoder;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * In-memory S3 bucket behind a {@link TestingHttpClient}. Requests without a SigV4
 * {@code Authorization} header are rejected with {@code AccessDenied}.
 */
public class TestingS3Server
        implements TestingHttpClient.Processor
{
    private static final Pattern MANIFEST_PART = Pattern.compile("<PartNumber>(\\d+)</PartNumber>\\s*<ETag>([^<]*)</ETag>");

    private final BucketAddress bucketAddress;
    private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();
    private final Map<String, SortedMap<Integer, byte[]>> uploads = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final List<InjectedFailure> failures = new CopyOnWriteArrayList<>();
    private final AtomicInteger uploadIds = new AtomicInteger();
    private final AtomicInteger partsInFlight = new AtomicInteger();
    private final AtomicInteger maxPartsInFlight = new AtomicInteger();
    private volatile long partDelayMillis;

    public TestingS3Server(BucketAddress bucketAddress)
    {
        this.bucketAddress = requireNonNull(bucketAddress, "bucketAddress is null");
    }

    public TestingHttpClient httpClient()
    {
        return new TestingHttpClient(this);
    }

    public void failRequests(Predicate<RecordedRequest> predicate, int statusCode, String errorCode)
    {
        failures.add(new InjectedFailure(predicate, statusCode, errorCode));
    }

    public void setPartDelayMillis(long partDelayMillis)
    {
        this.partDelayMillis = partDelayMillis;
    }

    public void putObject(String key, byte[] content)
    {
        objects.put(key, new StoredObject(content, Optional.empty(), ImmutableMap.of()));
    }

    public Optional<byte[]> object(String key)
    {
        return Optional.ofNullable(objects.get(key)).map(StoredObject::content);
    }

    public Optional<StoredObject> storedObject(String key)
    {
        return Optional.ofNullable(objects.get(key));
    }

    public List<RecordedRequest> requests()
    {
        return ImmutableList.copyOf(requests);
    }

    public List<RecordedRequest> requests(Predicate<RecordedRequest> predicate)
    {
        return requests.stream().filter(predicate).collect(ImmutableList.toImmutableList());
    }

    public int openUploads()
    {
        return uploads.size();
    }

    public int maxPartsInFlight()
    {
        return maxPartsInFlight.get();
    }

    @Override
    public Response handle(Request request)
            throws Exception
    {
        RecordedRequest recorded = record(request);
        requests.add(recorded);

        if (!recorded.header("authorization").map(value -> value.startsWith("AWS4-HMAC-SHA256 Credential=")).orElse(false)) {
            return error(403, "AccessDenied", "Missing signature");
        }
        for (InjectedFailure failure : failures) {
            if (failure.predicate().test(recorded)) {
                return error(failure.statusCode(), failure.errorCode(), "Injected failure");
            }
        }

        if (recorded.isBucketRequest()) {
            return handleBucket(recorded);
        }
        if (recorded.isInitiate()) {
            String uploadId = "upload-" + uploadIds.incrementAndGet();
            uploads.put(uploadId, new TreeMap<>());
            return xml(200, """
                    <?xml version="1.0" encoding="UTF-8"?>
                    <InitiateMultipartUploadResult xmlns="http://s3.amazonaws.com/doc/2006-03-01/">
                      <Bucket>%s</Bucket><Key>%s</Key><UploadId>%s</UploadId>
                    </InitiateMultipartUploadResult>""".formatted(bucketAddress.bucket(), recorded.key(), uploadId));
        }
        if (recorded.isUploadPart()) {
            return uploadPart(recorded);
        }
        if (recorded.isComplete()) {
            return complete(recorded);
        }
        if (recorded.isAbort()) {
            if (uploads.remove(recorded.queryParameter("uploadId").orElseThrow()) == null) {
                return error(404, "NoSuchUpload", "The specified upload does not exist");
            }
            return empty(204, ImmutableListMultimap.of());
        }
        return handleObject(recorded);
    }

    private Response handleBucket(RecordedRequest request)
    {
        return switch (request.method()) {
            case "GET" -> list(request);
            case "PUT" -> empty(200, ImmutableListMultimap.of("Location", "/" + bucketAddress.bucket()));
            case "DELETE" -> empty(204, ImmutableListMultimap.of());
            default -> error(405, "MethodNotAllowed", request.method());
        };
    }

    private Response handleObject(RecordedRequest request)
    {
        String key = request.key();
        switch (request.method()) {
            case "PUT" -> {
                ImmutableMap.Builder<String, String> metadata = ImmutableMap.builder();
                request.headers().forEach((name, value) -> {
                    if (name.startsWith("x-amz-meta-")) {
                        metadata.put(name.substring("x-amz-meta-".length()), value);
                    }
                });
                objects.put(key, new StoredObject(request.body(), request.header("content-type"), metadata.buildOrThrow()));
                return empty(200, ImmutableListMultimap.of("ETag", quoted(eTag(request.body())), "x-amz-version-id", "v1"));
            }
            case "GET", "HEAD" -> {
                StoredObject object = objects.get(key);
                if (object == null) {
                    return request.method().equals("HEAD") ? empty(404, ImmutableListMultimap.of()) : error(404, "NoSuchKey", "The specified key does not exist.");
                }
                ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.<String, String>builder()
                        .put("ETag", quoted(eTag(object.content())))
                        .put("Content-Length", String.valueOf(object.content().length))
                        .put("Last-Modified", "Fri, 24 May 2013 00:00:00 GMT");
                object.contentType().ifPresent(value -> headers.put("Content-Type", value));
                object.metadata().forEach((name, value) -> headers.put("x-amz-meta-" + name, value));
                byte[] body = request.method().equals("HEAD") ? new byte[0] : object.content();
                return new TestingResponse(HttpStatus.OK, headers.build(), body);
            }
            case "DELETE" -> {
                objects.remove(key);
                return empty(204, ImmutableListMultimap.of("x-amz-delete-marker", "true", "x-amz-version-id", "v2"));
            }
            default -> {
                return error(405, "MethodNotAllowed", request.method());
            }
        }
    }

    private Response list(RecordedRequest request)
    {
        String prefix = request.queryParameter("prefix").orElse("");
        int maxKeys = request.queryParameter("max-keys").map(Integer::parseInt).orElse(1000);
        int start = request.queryParameter("continuation-token").map(Integer::parseInt).orElse(0);

        List<String> keys = objects.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .collect(ImmutableList.toImmutableList());
        List<String> page = keys.subList(Math.min(start, keys.size()), Math.min(start + maxKeys, keys.size()));
        boolean truncated = start + maxKeys < keys.size();

        StringBuilder xml = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<ListBucketResult xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">")
                .append("<Name>").append(bucketAddress.bucket()).append("</Name>")
                .append("<Prefix>").append(prefix).append("</Prefix>")
                .append("<KeyCount>").append(page.size()).append("</KeyCount>")
                .append("<MaxKeys>").append(maxKeys).append("</MaxKeys>")
                .append("<IsTruncated>").append(truncated).append("</IsTruncated>");
        if (truncated) {
            xml.append("<NextContinuationToken>").append(start + maxKeys).append("</NextContinuationToken>");
        }
        for (String key : page) {
            byte[] content = objects.get(key).content();
            xml.append("<Contents>")
                    .append("<Key>").append(key).append("</Key>")
                    .append("<LastModified>2013-05-24T00:00:00.000Z</LastModified>")
                    .append("<ETag>&quot;").append(eTag(content)).append("&quot;</ETag>")
                    .append("<Size>").append(content.length).append("</Size>")
                    .append("</Contents>");
        }
        xml.append("</ListBucketResult>");
        return xml(200, xml.toString());
    }

    private Response uploadPart(RecordedRequest request)
            throws InterruptedException
    {
        SortedMap<Integer, byte[]> parts = uploads.get(request.queryParameter("uploadId").orElseThrow());
        if (parts == null) {
            return error(404, "NoSuchUpload", "The specified upload does not exist");
        }

        int inFlight = partsInFlight.incrementAndGet();
        maxPartsInFlight.accumulateAndGet(inFlight, Math::max);
        try {
            if (partDelayMillis > 0) {
                Thread.sleep(partDelayMillis);
            }
            synchronized (parts) {
                parts.put(request.partNumber(), request.body());
            }
        }
        finally {
            partsInFlight.decrementAndGet();
        }
        return empty(200, ImmutableListMultimap.of("ETag", quoted(eTag(request.body()))));
    }

    private Response complete(RecordedRequest request)
    {
        String uploadId = request.queryParameter("uploadId").orElseThrow();
        SortedMap<Integer, byte[]> parts = uploads.get(uploadId);
        if (parts == null) {
            return error(404, "NoSuchUpload", "The specified upload does not exist");
        }

        ByteArrayOutputStream content = new ByteArrayOutputStream();
        Matcher matcher = MANIFEST_PART.matcher(request.bodyAsString().replace("&quot;", "\""));
        int previous = 0;
        int count = 0;
        synchronized (parts) {
            while (matcher.find()) {
                int partNumber = Integer.parseInt(matcher.group(1));
                byte[] part = parts.get(partNumber);
                if (partNumber <= previous) {
                    return error(400, "InvalidPartOrder", "The list of parts was not in ascending order");
                }
                if (part == null || !matcher.group(2).equals(quoted(eTag(part)))) {
                    return error(400, "InvalidPart", "One or more of the specified parts could not be found");
                }
                content.writeBytes(part);
                previous = partNumber;
                count++;
            }
        }
        if (count == 0) {
            return error(400, "MalformedXML", "The XML you provided was not well-formed");
        }

        uploads.remove(uploadId);
        objects.put(request.key(), new StoredObject(content.toByteArray(), Optional.empty(), ImmutableMap.of()));
        return xml(200, """
                <?xml version="1.0" encoding="UTF-8"?>
                <CompleteMultipartUploadResult xmlns="http://s3.amazonaws.com/doc/2006-03-01/">
                  <Location>https://example.com/%1$s</Location>
                  <Bucket>%2$s</Bucket>
                  <Key>%1$s</Key>
                  <ETag>&quot;%3$s-%4$s&quot;</ETag>
                </CompleteMultipartUploadResult>""".formatted(request.key(), bucketAddress.bucket(), eTag(content.toByteArray()), count));
    }

    private RecordedRequest record(Request request)
    {
        String path = request.getUri().getPath();
        String basePath = bucketAddress.basePath();
        String key = path.startsWith(basePath) ? path.substring(basePath.length()) : path;
        key = key.startsWith("/") ? key.substring(1) : key;

        ImmutableMap.Builder<String, String> query = ImmutableMap.builder();
        String rawQuery = request.getUri().getRawQuery();
        if (rawQuery != null) {
            for (String parameter : Splitter.on('&').split(rawQuery)) {
                List<String> parts = Splitter.on('=').limit(2).splitToList(parameter);
                query.put(URLDecoder.decode(parts.get(0), UTF_8), parts.size() > 1 ? URLDecoder.decode(parts.get(1), UTF_8) : "");
            }
        }

        ImmutableListMultimap.Builder<String, String> headers = ImmutableListMultimap.builder();
        request.getHeaders().forEach((name, value) -> headers.put(name.toLowerCase(Locale.ROOT), value));

        byte[] body = new byte[0];
        if (request.getBodyGenerator() instanceof StaticBodyGenerator staticBody) {
            body = staticBody.getBody();
        }
        return new RecordedRequest(request.getMethod(), request.getUri().getRawPath(), key, query.buildOrThrow(), headers.build(), body);
    }

    private static String eTag(byte[] content)
    {
        return Hashing.sha256().hashBytes(content).toString().substring(0, 32);
    }

    private static String quoted(String value)
    {
        return "\"" + value + "\"";
    }

    private static Response xml(int statusCode, String body)
    {
        return new TestingResponse(HttpStatus.fromStatusCode(statusCode), ImmutableListMultimap.of("Content-Type", "application/xml"), body.getBytes(UTF_8));
    }

    private static Response empty(int statusCode, ListMultimap<String, String> headers)
    {
        return new TestingResponse(HttpStatus.fromStatusCode(statusCode), headers, new byte[0]);
    }

    private static Response error(int statusCode, String code, String message)
    {
        return xml(statusCode, """
                <?xml version="1.0" encoding="UTF-8"?>
                <Error><Code>%s</Code><Message>%s</Message><RequestId>req-%s</RequestId></Error>""".formatted(code, message, statusCode));
    }

    public record StoredObject(byte[] content, Optional<String> contentType, Map<String, String> metadata) {}

    private record InjectedFailure(Predicate<RecordedRequest> predicate, int statusCode, String errorCode) {}
}
