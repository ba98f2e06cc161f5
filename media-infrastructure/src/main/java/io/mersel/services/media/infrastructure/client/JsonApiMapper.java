package io.mersel.services.media.infrastructure.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mersel.services.media.application.enums.AssetDeliveryState;
import io.mersel.services.media.application.enums.AssetKind;
import io.mersel.services.media.application.models.DeliveryDescriptor;
import io.mersel.services.media.application.models.RemoteAsset;
import io.mersel.services.media.application.models.UploadOperation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * App Store Connect JSON:API belgeleri ile modeller arasındaki dönüşümler.
 * <p>
 * İstek gövdeleri {@code {"data": {...}}} biçimindedir; yanıtlarda {@code data} tekil nesne
 * veya dizi olabilir.
 */
final class JsonApiMapper {

    private final ObjectMapper mapper;

    JsonApiMapper(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    static String setResourceType(AssetKind kind) {
        return kind == AssetKind.SCREENSHOT ? "appScreenshotSets" : "appPreviewSets";
    }

    static String assetResourceType(AssetKind kind) {
        return kind == AssetKind.SCREENSHOT ? "appScreenshots" : "appPreviews";
    }

    // ── İstek gövdeleri ──────────────────────────────────────────────

    ObjectNode createSetRequest(AssetKind kind, String remoteType, String localizationId) {
        ObjectNode data = resource(setResourceType(kind), null);
        data.putObject("attributes")
                .put(kind == AssetKind.SCREENSHOT ? "screenshotDisplayType" : "previewType", remoteType);
        data.putObject("relationships")
                .set("appStoreVersionLocalization", linkage("appStoreVersionLocalizations", localizationId));
        return wrap(data);
    }

    ObjectNode reserveRequest(AssetKind kind, String setId, String fileName, long fileSize, String mimeType) {
        ObjectNode data = resource(assetResourceType(kind), null);
        ObjectNode attributes = data.putObject("attributes");
        attributes.put("fileName", fileName);
        attributes.put("fileSize", fileSize);
        if (mimeType != null) {
            attributes.put("mimeType", mimeType);
        }
        String relationship = kind == AssetKind.SCREENSHOT ? "appScreenshotSet" : "appPreviewSet";
        data.putObject("relationships").set(relationship, linkage(setResourceType(kind), setId));
        return wrap(data);
    }

    ObjectNode commitRequest(AssetKind kind, String assetId, String checksum, boolean uploaded) {
        ObjectNode data = resource(assetResourceType(kind), assetId);
        data.putObject("attributes")
                .put("sourceFileChecksum", checksum)
                .put("uploaded", uploaded);
        return wrap(data);
    }

    ObjectNode reorderRequest(AssetKind kind, List<String> orderedIds) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode data = root.putArray("data");
        for (String id : orderedIds) {
            data.add(resource(assetResourceType(kind), id));
        }
        return root;
    }

    private ObjectNode linkage(String type, String id) {
        ObjectNode node = mapper.createObjectNode();
        node.set("data", resource(type, id));
        return node;
    }

    private ObjectNode resource(String type, String id) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", type);
        if (id != null) {
            node.put("id", id);
        }
        return node;
    }

    private ObjectNode wrap(ObjectNode data) {
        ObjectNode root = mapper.createObjectNode();
        root.set("data", data);
        return root;
    }

    // ── Yanıt ayrıştırma ─────────────────────────────────────────────

    RemoteAsset toRemoteAsset(JsonNode data, AssetKind kind) {
        JsonNode attrs = data.path("attributes");
        JsonNode deliveryState = attrs.path("assetDeliveryState");

        List<String> errors = new ArrayList<>();
        for (JsonNode error : deliveryState.path("errors")) {
            String code = error.path("code").asText("");
            String description = error.path("description").asText("");
            errors.add(description.isEmpty() ? code : code + ": " + description);
        }

        return new RemoteAsset(
                data.path("id").asText(),
                textOrNull(attrs, "fileName"),
                attrs.path("fileSize").asLong(0),
                textOrNull(attrs, "sourceFileChecksum"),
                AssetDeliveryState.fromApiValue(textOrNull(deliveryState, "state")),
                toDelivery(attrs, kind),
                List.copyOf(errors)
        );
    }

    private DeliveryDescriptor toDelivery(JsonNode attrs, AssetKind kind) {
        if (kind == AssetKind.PREVIEW) {
            String videoUrl = textOrNull(attrs, "videoUrl");
            return videoUrl != null ? DeliveryDescriptor.video(videoUrl) : null;
        }
        JsonNode image = attrs.path("imageAsset");
        String templateUrl = textOrNull(image, "templateUrl");
        if (templateUrl == null) {
            return null;
        }
        return DeliveryDescriptor.imageTemplate(templateUrl,
                image.path("width").asInt(0), image.path("height").asInt(0));
    }

    List<UploadOperation> toUploadOperations(JsonNode data) {
        List<UploadOperation> operations = new ArrayList<>();
        for (JsonNode op : data.path("attributes").path("uploadOperations")) {
            Map<String, String> headers = new LinkedHashMap<>();
            for (JsonNode header : op.path("requestHeaders")) {
                String name = textOrNull(header, "name");
                String value = textOrNull(header, "value");
                if (name != null && value != null) {
                    headers.put(name, value);
                }
            }
            operations.add(new UploadOperation(
                    op.path("method").asText("PUT"),
                    textOrNull(op, "url"),
                    op.path("offset").asLong(0),
                    op.path("length").asLong(0),
                    Map.copyOf(headers)
            ));
        }
        return operations;
    }

    /**
     * JSON:API hata gövdesinden okunabilir mesaj çıkarır.
     */
    String errorDetail(JsonNode body) {
        if (body == null || !body.has("errors")) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode error : body.path("errors")) {
            String detail = textOrNull(error, "detail");
            String title = textOrNull(error, "title");
            String code = textOrNull(error, "code");
            parts.add((code != null ? code + ": " : "") + (detail != null ? detail : title != null ? title : ""));
        }
        return String.join("; ", parts);
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
