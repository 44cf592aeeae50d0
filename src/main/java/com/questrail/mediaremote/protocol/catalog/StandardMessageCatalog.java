package com.questrail.mediaremote.protocol.catalog;

import com.questrail.mediaremote.protocol.codec.impl.ClientUpdatesConfigCodec;
import com.questrail.mediaremote.protocol.codec.impl.GenericMessageCodec;
import com.questrail.mediaremote.protocol.codec.impl.ModifyOutputContextRequestCodec;
import com.questrail.mediaremote.protocol.codec.impl.TransactionMessageCodec;
import com.questrail.mediaremote.protocol.model.ClientUpdatesConfig;
import com.questrail.mediaremote.protocol.model.GenericMessage;
import com.questrail.mediaremote.protocol.model.ModifyOutputContextRequest;
import com.questrail.mediaremote.protocol.model.TransactionMessage;

/**
 * Factory for catalogs that already know the {@link StandardMessageKind}s.
 *
 * <p>Applications that carry their own payload kinds start from
 * {@link #builder()} and register the rest before building.</p>
 */
public final class StandardMessageCatalog
{
    private StandardMessageCatalog() {}

    public static MessageCatalog.Builder builder() {
        GenericMessageCodec generic = new GenericMessageCodec();
        ClientUpdatesConfigCodec updates = new ClientUpdatesConfigCodec();
        TransactionMessageCodec transaction = new TransactionMessageCodec();
        ModifyOutputContextRequestCodec outputContext = new ModifyOutputContextRequestCodec();

        return MessageCatalog.builder()
                .register(StandardMessageKind.GENERIC.tag(),
                        GenericMessage.class, generic, generic)
                .register(StandardMessageKind.CLIENT_UPDATES_CONFIG.tag(),
                        ClientUpdatesConfig.class, updates, updates)
                .register(StandardMessageKind.TRANSACTION.tag(),
                        TransactionMessage.class, transaction, transaction)
                .register(StandardMessageKind.MODIFY_OUTPUT_CONTEXT_REQUEST.tag(),
                        ModifyOutputContextRequest.class, outputContext, outputContext);
    }

    public static MessageCatalog create() {
        return builder().build();
    }
}
