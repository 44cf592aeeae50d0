package com.questrail.mediaremote.protocol.codec.impl;

import com.google.protobuf.CodedInputStream;
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import com.questrail.mediaremote.protocol.codec.MalformedPayloadException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * ProtobufFields
 * -----------------------------------------------------------------------------
 * Field-tagged read/write helpers shared by the envelope wire format and the
 * standard payload codecs.
 *
 * <p>The protobuf runtime's {@link CodedInputStream} and
 * {@link CodedOutputStream} provide varint and length-delimited primitives;
 * this class adds the loop that visits each field once, skips unknown
 * fields, and maps parse failures to {@link MalformedPayloadException}.</p>
 */
final class ProtobufFields
{
    private ProtobufFields() {}

    /**
     * Receives one field. Returns {@code false} to have the field skipped as unknown.
     */
    @FunctionalInterface
    interface FieldVisitor {
        boolean visit(int fieldNumber, int wireType, CodedInputStream in) throws IOException;
    }

    @FunctionalInterface
    interface FieldWriter {
        void write(CodedOutputStream out) throws IOException;
    }

    static int fieldNumber(int tag) {
        return tag >>> 3;
    }

    static int wireType(int tag) {
        return tag & 0x7;
    }

    /**
     * Visits every field in {@code bytes} in wire order.
     *
     * @param what human readable name of the message, used in failure messages
     * @throws MalformedPayloadException if the bytes are truncated or otherwise invalid
     */
    static void readFields(byte[] bytes, String what, FieldVisitor visitor) {
        CodedInputStream in = CodedInputStream.newInstance(bytes);
        try {
            while (true) {
                int tag = in.readTag();
                if (tag == 0) {
                    return;
                }
                if (!visitor.visit(fieldNumber(tag), wireType(tag), in)) {
                    in.skipField(tag);
                }
            }
        } catch (IOException e) {
            throw new MalformedPayloadException("Invalid " + what + " bytes", e);
        }
    }

    static void requireWireType(int fieldNumber, int actual, int expected, String what) {
        if (actual != expected) {
            throw new MalformedPayloadException(
                    what + " field " + fieldNumber + " has wire type " + actual
                            + " (expected " + expected + ")");
        }
    }

    static void requireVarint(int fieldNumber, int actual, String what) {
        requireWireType(fieldNumber, actual, WireFormat.WIRETYPE_VARINT, what);
    }

    static void requireLengthDelimited(int fieldNumber, int actual, String what) {
        requireWireType(fieldNumber, actual, WireFormat.WIRETYPE_LENGTH_DELIMITED, what);
    }

    static byte[] write(FieldWriter writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.write(out);
            out.flush();
        } catch (IOException e) {
            // ByteArrayOutputStream does not fail; anything here is a bug.
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }
}
