package win.ixuni.b2bridge.driver.b2.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import win.ixuni.b2bridge.driver.b2.http.B2HttpResponse;
import win.ixuni.b2bridge.driver.b2.model.B2Bucket;
import win.ixuni.b2bridge.driver.b2.model.B2File;
import win.ixuni.b2bridge.driver.b2.model.B2FilePage;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts B2 JSON records and download headers into {@link B2Bucket} and {@link B2File}.
 * <p>
 * List variants keep the response order. A missing {@code buckets} or {@code files} array
 * maps to an empty list.
 */
@RequiredArgsConstructor
public class B2ResourceMapper {

    private static final String INFO_HEADER_PREFIX = "x-bz-info-";

    private final String driverName;

    public B2Bucket toBucket(JsonNode item) {
        return B2Bucket.builder()
                .id(text(item, "bucketId"))
                .name(text(item, "bucketName"))
                .bucketType(text(item, "bucketType"))
                .driverName(driverName)
                .build();
    }

    public List<B2Bucket> toBuckets(JsonNode response) {
        List<B2Bucket> buckets = new ArrayList<>();
        for (JsonNode item : array(response, "buckets")) {
            buckets.add(toBucket(item));
        }
        return buckets;
    }

    /**
     * @param bucket back-reference, may be null when the call did not name a bucket
     */
    public B2File toFile(JsonNode item, B2Bucket bucket) {
        Long size = number(item, "size");
        if (size == null) {
            size = number(item, "contentLength");
        }

        Map<String, String> fileInfo = new LinkedHashMap<>();
        JsonNode info = item.get("fileInfo");
        if (info != null && info.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = info.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                fileInfo.put(field.getKey(), field.getValue().asText());
            }
        }

        return B2File.builder()
                .fileId(text(item, "fileId"))
                .name(text(item, "fileName"))
                .size(size)
                .contentSha1(text(item, "contentSha1"))
                .contentType(text(item, "contentType"))
                .fileInfo(fileInfo)
                .uploadTimestamp(number(item, "uploadTimestamp"))
                .action(text(item, "action"))
                .bucket(bucket)
                .build();
    }

    public List<B2File> toFiles(JsonNode response, B2Bucket bucket) {
        List<B2File> files = new ArrayList<>();
        for (JsonNode item : array(response, "files")) {
            files.add(toFile(item, bucket));
        }
        return files;
    }

    public B2FilePage toFilePage(JsonNode response, B2Bucket bucket) {
        return B2FilePage.builder()
                .files(toFiles(response, bucket))
                .nextFileName(text(response, "nextFileName"))
                .nextFileId(text(response, "nextFileId"))
                .build();
    }

    /**
     * Rebuild the file record a download carries in its {@code X-Bz-*} headers.
     *
     * @param fallback used for fields the headers do not carry
     */
    public B2File fromDownloadHeaders(B2HttpResponse response, B2File fallback) {
        Map<String, String> fileInfo = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> header : response.getHeaders().entrySet()) {
            String name = header.getKey();
            if (name != null && name.toLowerCase(Locale.ROOT).startsWith(INFO_HEADER_PREFIX) && !header.getValue().isEmpty()) {
                fileInfo.put(name.substring(INFO_HEADER_PREFIX.length()),
                        URLDecoder.decode(header.getValue().get(0), StandardCharsets.UTF_8));
            }
        }

        B2File.B2FileBuilder file = fallback != null ? fallback.toBuilder() : B2File.builder();
        response.header("x-bz-file-id").ifPresent(file::fileId);
        response.header("x-bz-file-name")
                .map(name -> URLDecoder.decode(name, StandardCharsets.UTF_8))
                .ifPresent(file::name);
        response.header("x-bz-content-sha1")
                .filter(sha1 -> !"none".equals(sha1))
                .ifPresent(file::contentSha1);
        response.header("Content-Type").ifPresent(file::contentType);
        response.longHeader("Content-Length").ifPresent(file::size);
        response.longHeader("x-bz-upload-timestamp").ifPresent(file::uploadTimestamp);
        if (!fileInfo.isEmpty()) {
            file.fileInfo(fileInfo);
        }
        return file.build();
    }

    private static Iterable<JsonNode> array(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        return value != null && value.isArray() ? value : List.of();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && !value.isNull() ? value.asText() : null;
    }

    private static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }
}
