/**
 * Protobuf-runtime implementations of the envelope wire format and of the
 * standard payload codecs.
 *
 * <p>Messages are read and written field by field with
 * {@code CodedInputStream} / {@code CodedOutputStream}; no generated message
 * classes are involved. Unknown fields are skipped so newer peers can add
 * fields without breaking older readers.</p>
 */
package com.questrail.mediaremote.protocol.codec.impl;
