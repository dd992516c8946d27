package org.cellar.indexing.mirror;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.cellar.core.mirror.MirrorSynchronizer;
import org.cellar.core.model.CatalogRecord;
import org.cellar.indexing.model.RecordPayload;

import java.util.Locale;

/**
 * One pending change for the mirror. Travels as JSON when updates are queued through the broker.
 */
public record MirrorUpdate(Type type, String recordId, RecordPayload record) {
	private static final Gson gson = new Gson();

	public enum Type {
		UPSERT,
		DELETE
	}

	public MirrorUpdate {
		if (type == null || recordId == null || recordId.isBlank()) {
			throw new IllegalArgumentException("Mirror update needs a type and a record id");
		}
		if (type == Type.UPSERT && record == null) {
			throw new IllegalArgumentException("Upsert of " + recordId + " carries no record");
		}
	}

	public static MirrorUpdate upsert(CatalogRecord record) {
		return new MirrorUpdate(Type.UPSERT, record.id(), RecordPayload.from(record));
	}

	public static MirrorUpdate delete(String recordId) {
		return new MirrorUpdate(Type.DELETE, recordId, null);
	}

	/**
	 * @return whether the mirror accepted the change
	 */
	public boolean applyTo(MirrorSynchronizer synchronizer) {
		return type == Type.UPSERT ? synchronizer.upsert(record.toRecord()) : synchronizer.delete(recordId);
	}

	public String toJson() {
		return gson.toJson(this);
	}

	/**
	 * Decodes a queued message, rejecting anything without a known type, a record id, and a record for upserts.
	 */
	public static MirrorUpdate fromJson(String json) {
		JsonElement element = JsonParser.parseString(json);
		if (!element.isJsonObject()) {
			throw new JsonParseException("Mirror update message is not a JSON object");
		}
		JsonObject object = element.getAsJsonObject();

		Type type = parseType(requireString(object, "type"));
		String recordId = requireString(object, "recordId");
		JsonElement recordJson = object.get("record");
		RecordPayload record = recordJson == null || recordJson.isJsonNull()
				? null
				: gson.fromJson(recordJson, RecordPayload.class);
		if (type == Type.UPSERT && record == null) {
			throw new JsonParseException("Upsert of " + recordId + " carries no record");
		}
		return new MirrorUpdate(type, recordId, record);
	}

	private static String requireString(JsonObject object, String key) {
		JsonElement value = object.get(key);
		if (value == null || !value.isJsonPrimitive() || value.getAsString().isBlank()) {
			throw new JsonParseException("Mirror update is missing '" + key + "'");
		}
		return value.getAsString();
	}

	private static Type parseType(String value) {
		for (Type type : Type.values()) {
			if (type.name().equals(value.toUpperCase(Locale.ROOT))) {
				return type;
			}
		}
		throw new JsonParseException("Unknown mirror update type '" + value + "'");
	}
}
