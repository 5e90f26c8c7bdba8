package com.ghack.codec;

import com.ghack.protocol.AddEntity;
import com.ghack.protocol.AssignControl;
import com.ghack.protocol.CombatHit;
import com.ghack.protocol.Connect;
import com.ghack.protocol.Disconnect;
import com.ghack.protocol.DisconnectReason;
import com.ghack.protocol.EntityDeath;
import com.ghack.protocol.Envelope;
import com.ghack.protocol.Login;
import com.ghack.protocol.LoginFailure;
import com.ghack.protocol.LoginResult;
import com.ghack.protocol.MessageType;
import com.ghack.protocol.Move;
import com.ghack.protocol.Payload;
import com.ghack.protocol.RemoveEntity;
import com.ghack.protocol.UpdateState;
import com.ghack.protocol.Vector3;
import com.ghack.protocol.value.StateValue;
import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import io.netty.handler.codec.EncoderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts envelopes to and from their body bytes (the part of a frame
 * after the length prefix).
 *
 * The body is the protocol buffers (proto2) encoding of the ghack
 * {@code Message} schema, written field by field with protobuf's coded
 * streams so that field numbers stay bit-compatible with existing peers.
 * Decoding follows proto2 rules: unknown fields are skipped, the last
 * occurrence of a singular field wins and a missing required field makes
 * the payload malformed. Payload fields that do not match the envelope
 * type are skipped without being parsed.
 *
 * The serializer keeps no mutable state and is safe to share between
 * connections.
 */
public class EnvelopeSerializer {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeSerializer.class);

    private static final int ENVELOPE_TYPE_FIELD = 1;

    private final int maxArrayDepth;

    public EnvelopeSerializer(int maxArrayDepth) {
        if (maxArrayDepth < 1) {
            throw new IllegalArgumentException("maxArrayDepth must be at least 1, got " + maxArrayDepth);
        }
        this.maxArrayDepth = maxArrayDepth;
    }

    public int getMaxArrayDepth() {
        return maxArrayDepth;
    }

    // === Encoding ===

    /**
     * Serializes an envelope to its body bytes. No size limit is applied here.
     */
    public byte[] serialize(Envelope envelope) {
        MessageType type = envelope.getType();
        byte[] body = serializePayload(envelope.getPayload());
        return write(out -> {
            out.writeEnum(ENVELOPE_TYPE_FIELD, type.id());
            out.writeByteArray(type.payloadField(), body);
        });
    }

    private byte[] serializePayload(Payload payload) {
        switch (payload.type()) {
            case CONNECT: {
                Connect connect = (Connect) payload;
                return write(out -> {
                    out.writeUInt32(1, connect.getVersion());
                    writeOptionalString(out, 2, connect.getVersionString());
                });
            }
            case DISCONNECT: {
                Disconnect disconnect = (Disconnect) payload;
                return write(out -> {
                    out.writeEnum(1, disconnect.getReason().id());
                    writeOptionalString(out, 2, disconnect.getReasonText());
                });
            }
            case LOGIN: {
                Login login = (Login) payload;
                return write(out -> {
                    out.writeString(1, login.getName());
                    writeOptionalString(out, 2, login.getAuthToken());
                    if (login.hasPermissions()) {
                        out.writeUInt32(3, login.getPermissions());
                    }
                });
            }
            case LOGIN_RESULT: {
                LoginResult result = (LoginResult) payload;
                return write(out -> {
                    out.writeBool(1, result.isSucceeded());
                    if (result.hasReason()) {
                        out.writeEnum(2, result.getReason().id());
                    }
                });
            }
            case ADD_ENTITY: {
                AddEntity add = (AddEntity) payload;
                return write(out -> {
                    out.writeInt32(1, add.getId());
                    writeOptionalString(out, 2, add.getName());
                });
            }
            case REMOVE_ENTITY: {
                RemoveEntity remove = (RemoveEntity) payload;
                return write(out -> {
                    out.writeInt32(1, remove.getId());
                    writeOptionalString(out, 2, remove.getName());
                });
            }
            case UPDATE_STATE: {
                UpdateState update = (UpdateState) payload;
                byte[] value = serializeValue(update.getValue());
                return write(out -> {
                    out.writeInt32(1, update.getId());
                    out.writeString(2, update.getStateId());
                    out.writeByteArray(3, value);
                });
            }
            case MOVE: {
                byte[] direction = serializeVector(((Move) payload).getDirection());
                return write(out -> out.writeByteArray(1, direction));
            }
            case ASSIGN_CONTROL: {
                AssignControl assign = (AssignControl) payload;
                return write(out -> {
                    out.writeInt32(1, assign.getUid());
                    if (assign.getRevoked() != null) {
                        out.writeBool(2, assign.getRevoked());
                    }
                });
            }
            case ENTITY_DEATH: {
                EntityDeath death = (EntityDeath) payload;
                return write(out -> {
                    out.writeInt32(1, death.getUid());
                    writeOptionalString(out, 2, death.getName());
                    if (death.getKillerUid() != null) {
                        out.writeInt32(3, death.getKillerUid());
                    }
                    writeOptionalString(out, 4, death.getKillerName());
                });
            }
            case COMBAT_HIT: {
                CombatHit hit = (CombatHit) payload;
                return write(out -> {
                    out.writeInt32(1, hit.getAttackerUid());
                    writeOptionalString(out, 2, hit.getAttackerName());
                    out.writeInt32(3, hit.getVictimUid());
                    writeOptionalString(out, 4, hit.getVictimName());
                    out.writeFloat(5, hit.getDamage());
                });
            }
            default:
                throw new IllegalArgumentException("Unsupported payload type " + payload.type());
        }
    }

    private byte[] serializeValue(StateValue value) {
        byte[][] children = null;
        byte[] vector = null;
        if (value.getKind() == StateValue.Kind.ARRAY) {
            children = new byte[value.asArray().size()][];
            for (int i = 0; i < children.length; i++) {
                children[i] = serializeValue(value.asArray().get(i));
            }
        } else if (value.getKind() == StateValue.Kind.VECTOR3) {
            vector = serializeVector(value.asVector3());
        }

        byte[][] elements = children;
        byte[] vectorBytes = vector;
        return write(out -> {
            out.writeEnum(1, value.getKind().id());
            switch (value.getKind()) {
                case BOOL -> out.writeBool(2, value.asBool());
                case INT -> out.writeInt32(3, value.asInt());
                case FLOAT -> out.writeFloat(4, value.asFloat());
                case STRING -> out.writeString(5, value.asString());
                case VECTOR3 -> out.writeByteArray(6, vectorBytes);
                case ARRAY -> {
                    for (byte[] element : elements) {
                        out.writeByteArray(15, element);
                    }
                }
            }
        });
    }

    private static byte[] serializeVector(Vector3 vector) {
        return write(out -> {
            out.writeDouble(1, vector.getX());
            out.writeDouble(2, vector.getY());
            out.writeDouble(3, vector.getZ());
        });
    }

    private static void writeOptionalString(CodedOutputStream out, int field, String value) throws IOException {
        if (value != null) {
            out.writeString(field, value);
        }
    }

    @FunctionalInterface
    private interface FieldWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    private static byte[] write(FieldWriter writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.write(out);
            out.flush();
        } catch (IOException e) {
            throw new EncoderException("Failed to serialize message", e);
        }
        return bytes.toByteArray();
    }

    // === Decoding ===

    public Envelope deserialize(byte[] body) {
        return deserialize(body, 0, body.length);
    }

    /**
     * Parses one envelope from {@code length} bytes starting at {@code offset}.
     *
     * @throws MalformedPayloadException if the bytes do not form a valid envelope
     */
    public Envelope deserialize(byte[] body, int offset, int length) {
        try {
            return readEnvelope(CodedInputStream.newInstance(body, offset, length));
        } catch (IOException e) {
            logger.debug("Unparseable envelope of {} bytes", length, e);
            throw new MalformedPayloadException("Envelope does not parse: " + e.getMessage(), e);
        }
    }

    private Envelope readEnvelope(CodedInputStream in) throws IOException {
        Integer typeId = null;
        // last occurrence per payload slot: its bytes, or the tag when the wire type was wrong
        Map<Integer, byte[]> payloads = new HashMap<>();
        Map<Integer, Integer> misTyped = new HashMap<>();

        int tag;
        while ((tag = in.readTag()) != 0) {
            int field = WireFormat.getTagFieldNumber(tag);
            if (field == ENVELOPE_TYPE_FIELD) {
                expectWireType(tag, WireFormat.WIRETYPE_VARINT, "Message.type");
                typeId = in.readEnum();
            } else if (MessageType.fromPayloadField(field) != null
                    && WireFormat.getTagWireType(tag) == WireFormat.WIRETYPE_LENGTH_DELIMITED) {
                payloads.put(field, in.readByteArray());
                misTyped.remove(field);
            } else if (MessageType.fromPayloadField(field) != null) {
                // only an error if this turns out to be the slot named by type
                in.skipField(tag);
                payloads.remove(field);
                misTyped.put(field, tag);
            } else {
                in.skipField(tag);
            }
        }

        if (typeId == null) {
            throw new MalformedPayloadException("Missing required field Message.type");
        }
        MessageType type = MessageType.fromId(typeId);
        if (type == null) {
            throw new MalformedPayloadException("Unknown message type " + typeId);
        }
        Integer badTag = misTyped.get(type.payloadField());
        if (badTag != null) {
            expectWireType(badTag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Message payload " + type.payloadField());
        }
        byte[] payload = payloads.get(type.payloadField());
        if (payload == null) {
            throw new MalformedPayloadException("Message of type " + type + " carries no " + type + " payload");
        }
        return Envelope.of(readPayload(type, CodedInputStream.newInstance(payload)));
    }

    private Payload readPayload(MessageType type, CodedInputStream in) throws IOException {
        switch (type) {
            case CONNECT:
                return readConnect(in);
            case DISCONNECT:
                return readDisconnect(in);
            case LOGIN:
                return readLogin(in);
            case LOGIN_RESULT:
                return readLoginResult(in);
            case ADD_ENTITY: {
                IdAndName entity = readIdAndName(in, "AddEntity");
                return new AddEntity(entity.id, entity.name);
            }
            case REMOVE_ENTITY: {
                IdAndName entity = readIdAndName(in, "RemoveEntity");
                return new RemoveEntity(entity.id, entity.name);
            }
            case UPDATE_STATE:
                return readUpdateState(in);
            case MOVE:
                return readMove(in);
            case ASSIGN_CONTROL:
                return readAssignControl(in);
            case ENTITY_DEATH:
                return readEntityDeath(in);
            case COMBAT_HIT:
                return readCombatHit(in);
            default:
                throw new MalformedPayloadException("Unsupported message type " + type);
        }
    }

    private Connect readConnect(CodedInputStream in) throws IOException {
        Integer version = null;
        String versionString = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "Connect.version");
                    version = in.readUInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Connect.version_str");
                    versionString = in.readString();
                }
                default -> in.skipField(tag);
            }
        }
        return new Connect(require(version, "Connect.version"), versionString);
    }

    private Disconnect readDisconnect(CodedInputStream in) throws IOException {
        DisconnectReason reason = null;
        String reasonText = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "Disconnect.reason");
                    // an unknown enum value counts as absent
                    reason = DisconnectReason.fromId(in.readEnum());
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Disconnect.reason_str");
                    reasonText = in.readString();
                }
                default -> in.skipField(tag);
            }
        }
        return new Disconnect(require(reason, "Disconnect.reason"), reasonText);
    }

    private Login readLogin(CodedInputStream in) throws IOException {
        String name = null;
        String authToken = null;
        Integer permissions = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Login.name");
                    name = in.readString();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Login.authtoken");
                    authToken = in.readString();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "Login.permissions");
                    permissions = in.readUInt32();
                }
                default -> in.skipField(tag);
            }
        }
        return Login.builder(require(name, "Login.name"))
                .authToken(authToken)
                .permissions(permissions)
                .build();
    }

    private LoginResult readLoginResult(CodedInputStream in) throws IOException {
        Boolean succeeded = null;
        LoginFailure reason = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "LoginResult.succeeded");
                    succeeded = in.readBool();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "LoginResult.reason");
                    reason = LoginFailure.fromId(in.readEnum());
                }
                default -> in.skipField(tag);
            }
        }
        return LoginResult.of(require(succeeded, "LoginResult.succeeded"), reason);
    }

    private static final class IdAndName {
        private final int id;
        private final String name;

        private IdAndName(int id, String name) {
            this.id = id;
            this.name = name;
        }
    }

    private IdAndName readIdAndName(CodedInputStream in, String message) throws IOException {
        Integer id = null;
        String name = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, message + ".id");
                    id = in.readInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, message + ".name");
                    name = in.readString();
                }
                default -> in.skipField(tag);
            }
        }
        return new IdAndName(require(id, message + ".id"), name);
    }

    private UpdateState readUpdateState(CodedInputStream in) throws IOException {
        Integer id = null;
        String stateId = null;
        byte[] value = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "UpdateState.id");
                    id = in.readInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "UpdateState.state_id");
                    stateId = in.readString();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "UpdateState.value");
                    value = in.readByteArray();
                }
                default -> in.skipField(tag);
            }
        }
        return new UpdateState(
                require(id, "UpdateState.id"),
                require(stateId, "UpdateState.state_id"),
                readValue(CodedInputStream.newInstance(require(value, "UpdateState.value")), 0));
    }

    /**
     * @param enclosingArrays number of arrays this value is nested in
     */
    private StateValue readValue(CodedInputStream in, int enclosingArrays) throws IOException {
        Integer kindId = null;
        Boolean boolValue = null;
        Integer intValue = null;
        Float floatValue = null;
        String stringValue = null;
        Vector3 vectorValue = null;
        List<StateValue> elements = new ArrayList<>();

        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "StateValue.type");
                    kindId = in.readEnum();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "StateValue.bool_val");
                    boolValue = in.readBool();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "StateValue.int_val");
                    intValue = in.readInt32();
                }
                case 4 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED32, "StateValue.float_val");
                    floatValue = in.readFloat();
                }
                case 5 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "StateValue.string_val");
                    stringValue = in.readString();
                }
                case 6 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "StateValue.vector3_val");
                    vectorValue = readVector(CodedInputStream.newInstance(in.readByteArray()), "StateValue.vector3_val");
                }
                case 15 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "StateValue.array_val");
                    checkArrayDepth(enclosingArrays + 1);
                    elements.add(readValue(CodedInputStream.newInstance(in.readByteArray()), enclosingArrays + 1));
                }
                default -> in.skipField(tag);
            }
        }

        StateValue.Kind kind = StateValue.Kind.fromId(require(kindId, "StateValue.type"));
        if (kind == null) {
            throw new MalformedPayloadException("Unknown StateValue type " + kindId);
        }
        if (kind == StateValue.Kind.ARRAY) {
            checkArrayDepth(enclosingArrays + 1);
        }

        StateValue.Builder builder = StateValue.builder(kind);
        if (boolValue != null) {
            builder.boolValue(boolValue);
        }
        if (intValue != null) {
            builder.intValue(intValue);
        }
        if (floatValue != null) {
            builder.floatValue(floatValue);
        }
        if (stringValue != null) {
            builder.stringValue(stringValue);
        }
        if (vectorValue != null) {
            builder.vector3Value(vectorValue);
        }
        for (StateValue element : elements) {
            builder.addArrayElement(element);
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException(e.getMessage(), e);
        }
    }

    private void checkArrayDepth(int depth) {
        if (depth > maxArrayDepth) {
            throw new MalformedPayloadException("StateValue arrays nested deeper than " + maxArrayDepth);
        }
    }

    private Move readMove(CodedInputStream in) throws IOException {
        Vector3 direction = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            if (WireFormat.getTagFieldNumber(tag) == 1) {
                expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "Move.direction");
                direction = readVector(CodedInputStream.newInstance(in.readByteArray()), "Move.direction");
            } else {
                in.skipField(tag);
            }
        }
        return new Move(require(direction, "Move.direction"));
    }

    private Vector3 readVector(CodedInputStream in, String field) throws IOException {
        Double x = null;
        Double y = null;
        Double z = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED64, field + ".x");
                    x = in.readDouble();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED64, field + ".y");
                    y = in.readDouble();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED64, field + ".z");
                    z = in.readDouble();
                }
                default -> in.skipField(tag);
            }
        }
        return new Vector3(require(x, field + ".x"), require(y, field + ".y"), require(z, field + ".z"));
    }

    private AssignControl readAssignControl(CodedInputStream in) throws IOException {
        Integer uid = null;
        Boolean revoked = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "AssignControl.uid");
                    uid = in.readInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "AssignControl.revoked");
                    revoked = in.readBool();
                }
                default -> in.skipField(tag);
            }
        }
        return new AssignControl(require(uid, "AssignControl.uid"), revoked);
    }

    private EntityDeath readEntityDeath(CodedInputStream in) throws IOException {
        Integer uid = null;
        String name = null;
        Integer killerUid = null;
        String killerName = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "EntityDeath.uid");
                    uid = in.readInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "EntityDeath.name");
                    name = in.readString();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "EntityDeath.killer_uid");
                    killerUid = in.readInt32();
                }
                case 4 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "EntityDeath.killer_name");
                    killerName = in.readString();
                }
                default -> in.skipField(tag);
            }
        }
        return EntityDeath.builder(require(uid, "EntityDeath.uid"))
                .name(name)
                .killerUid(killerUid)
                .killerName(killerName)
                .build();
    }

    private CombatHit readCombatHit(CodedInputStream in) throws IOException {
        Integer attackerUid = null;
        String attackerName = null;
        Integer victimUid = null;
        String victimName = null;
        Float damage = null;
        int tag;
        while ((tag = in.readTag()) != 0) {
            switch (WireFormat.getTagFieldNumber(tag)) {
                case 1 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "CombatHit.attacker_uid");
                    attackerUid = in.readInt32();
                }
                case 2 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "CombatHit.attacker_name");
                    attackerName = in.readString();
                }
                case 3 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_VARINT, "CombatHit.victim_uid");
                    victimUid = in.readInt32();
                }
                case 4 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_LENGTH_DELIMITED, "CombatHit.victim_name");
                    victimName = in.readString();
                }
                case 5 -> {
                    expectWireType(tag, WireFormat.WIRETYPE_FIXED32, "CombatHit.damage");
                    damage = in.readFloat();
                }
                default -> in.skipField(tag);
            }
        }
        return CombatHit.builder(
                        require(attackerUid, "CombatHit.attacker_uid"),
                        require(victimUid, "CombatHit.victim_uid"),
                        require(damage, "CombatHit.damage"))
                .attackerName(attackerName)
                .victimName(victimName)
                .build();
    }

    private static void expectWireType(int tag, int expected, String field) {
        if (WireFormat.getTagWireType(tag) != expected) {
            throw new MalformedPayloadException("Field " + field + " has wire type "
                    + WireFormat.getTagWireType(tag) + ", expected " + expected);
        }
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw new MalformedPayloadException("Missing required field " + field);
        }
        return value;
    }
}
