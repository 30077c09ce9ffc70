package com.phillippitts.fleetdump.service.manifest;

import com.phillippitts.fleetdump.domain.DeviceResult;
import com.phillippitts.fleetdump.domain.Manifest;
import com.phillippitts.fleetdump.domain.OutcomeStatus;
import com.phillippitts.fleetdump.domain.UploadOutcome;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts {@link Manifest} to and from its {@code manifest.json} representation.
 *
 * <p>Keys are snake_case. Absent optional values are written as JSON {@code null} so every key is
 * always present; {@code recovered} is only written once a manifest has been recovered.
 */
final class ManifestJson {

    static final String ISSUE_ID = "issue_id";
    static final String TRIGGERED_BY = "triggered_by";
    static final String PATH_STRATEGY = "path_strategy";
    static final String REQUEST_DEVICE_ID = "request_device_id";
    static final String TARGETS = "targets";
    static final String RESULTS = "results";
    static final String SUCCESS_COUNT = "success_count";
    static final String FAIL_COUNT = "fail_count";
    static final String CANCELLED_COUNT = "cancelled_count";
    static final String ISSUE_DIR = "issue_dir";
    static final String UPLOAD_ENABLED = "upload_enabled";
    static final String CREATED_AT = "created_at";
    static final String UPLOAD_RESULT = "upload_result";
    static final String RECOVERED = "recovered";

    private ManifestJson() {}

    static JSONObject toJson(Manifest manifest) {
        JSONObject obj = new JSONObject();
        obj.put(ISSUE_ID, manifest.issueId());
        obj.put(TRIGGERED_BY, manifest.triggeredBy());
        obj.put(PATH_STRATEGY, manifest.pathStrategy());
        obj.put(REQUEST_DEVICE_ID, orNull(manifest.requestDeviceId()));
        obj.put(TARGETS, new JSONArray(manifest.targets()));

        JSONObject results = new JSONObject();
        for (Map.Entry<String, DeviceResult> entry : manifest.results().entrySet()) {
            results.put(entry.getKey(), resultToJson(entry.getValue()));
        }
        obj.put(RESULTS, results);

        obj.put(SUCCESS_COUNT, manifest.successCount());
        obj.put(FAIL_COUNT, manifest.failCount());
        obj.put(CANCELLED_COUNT, manifest.cancelledCount());
        obj.put(ISSUE_DIR, manifest.issueDir());
        obj.put(UPLOAD_ENABLED, orNull(manifest.uploadEnabled()));
        obj.put(CREATED_AT, manifest.createdAt() == null ? JSONObject.NULL : manifest.createdAt().toString());
        obj.put(UPLOAD_RESULT, manifest.uploadResult() == null ? JSONObject.NULL : uploadToJson(manifest.uploadResult()));
        if (manifest.recovered()) {
            obj.put(RECOVERED, true);
        }
        return obj;
    }

    static Manifest fromJson(String json) {
        JSONObject obj = new JSONObject(json);

        List<String> targets = new ArrayList<>();
        JSONArray targetArray = obj.optJSONArray(TARGETS);
        if (targetArray != null) {
            for (int i = 0; i < targetArray.length(); i++) {
                targets.add(targetArray.getString(i));
            }
        }

        Map<String, DeviceResult> results = new LinkedHashMap<>();
        JSONObject resultObj = obj.optJSONObject(RESULTS);
        if (resultObj != null) {
            for (String device : resultObj.keySet()) {
                results.put(device, resultFromJson(resultObj.getJSONObject(device)));
            }
        }

        Boolean uploadEnabled = obj.isNull(UPLOAD_ENABLED) ? null : obj.getBoolean(UPLOAD_ENABLED);
        Instant createdAt = obj.isNull(CREATED_AT) ? null : Instant.parse(obj.getString(CREATED_AT));
        UploadOutcome upload = obj.isNull(UPLOAD_RESULT)
                ? null : uploadFromJson(obj.getString(ISSUE_ID), obj.getJSONObject(UPLOAD_RESULT));

        return new Manifest(
                obj.getString(ISSUE_ID),
                obj.optString(TRIGGERED_BY, ""),
                obj.optString(PATH_STRATEGY, ""),
                obj.isNull(REQUEST_DEVICE_ID) ? null : obj.getString(REQUEST_DEVICE_ID),
                targets,
                results,
                obj.optInt(SUCCESS_COUNT, 0),
                obj.optInt(FAIL_COUNT, 0),
                obj.optInt(CANCELLED_COUNT, 0),
                obj.optString(ISSUE_DIR, ""),
                uploadEnabled,
                createdAt,
                upload,
                obj.optBoolean(RECOVERED, false));
    }

    private static JSONObject resultToJson(DeviceResult result) {
        JSONObject obj = new JSONObject();
        obj.put("success", result.success());
        obj.put("status", result.status().name().toLowerCase(Locale.ROOT));
        obj.put("detail", result.detail());
        obj.put("dump_path", orNull(result.dumpPath()));
        return obj;
    }

    private static DeviceResult resultFromJson(JSONObject obj) {
        OutcomeStatus status = OutcomeStatus.valueOf(obj.optString("status", "failed").toUpperCase(Locale.ROOT));
        return new DeviceResult(
                obj.optBoolean("success", false),
                status,
                obj.optString("detail", ""),
                obj.isNull("dump_path") ? null : obj.getString("dump_path"));
    }

    private static JSONObject uploadToJson(UploadOutcome upload) {
        JSONObject obj = new JSONObject();
        obj.put("success", upload.success());
        obj.put("message", upload.message());
        obj.put("upload_info", new JSONObject(upload.uploadInfo()));
        obj.put("uploaded_files", new JSONArray(upload.uploadedFiles()));
        obj.put("timestamp", upload.completedAt() == null ? JSONObject.NULL : upload.completedAt().toString());
        return obj;
    }

    private static UploadOutcome uploadFromJson(String issueId, JSONObject obj) {
        Map<String, String> info = new LinkedHashMap<>();
        JSONObject infoObj = obj.optJSONObject("upload_info");
        if (infoObj != null) {
            for (String key : infoObj.keySet()) {
                info.put(key, String.valueOf(infoObj.get(key)));
            }
        }
        List<String> files = new ArrayList<>();
        JSONArray fileArray = obj.optJSONArray("uploaded_files");
        if (fileArray != null) {
            for (int i = 0; i < fileArray.length(); i++) {
                files.add(fileArray.getString(i));
            }
        }
        Instant at = obj.isNull("timestamp") ? null : Instant.parse(obj.getString("timestamp"));
        return new UploadOutcome(issueId, obj.optBoolean("success", false), obj.optString("message", ""),
                files, info, at);
    }

    private static Object orNull(Object value) {
        return value == null ? JSONObject.NULL : value;
    }
}
