package com.questrail.mediaremote.protocol.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Modify output context request.
 *
 * <p>
 * Changes the set of output devices participating in a peer's playback. The
 * request carries up to three independent operations (adding, removing,
 * setting) for the addressed endpoint, and the same three again in a
 * cluster-aware form that applies to the peer's whole device cluster.
 * </p>
 *
 * <p>
 * An empty list means the operation is absent. The {@code type} is
 * {@code null} when the field was not present on the wire.
 * </p>
 *
 * @param type                  output context kind, may be {@code null}
 * @param adding                devices to add to the endpoint set
 * @param removing              devices to remove from the endpoint set
 * @param setting               replacement for the endpoint set
 * @param clusterAwareAdding    devices to add to the cluster set
 * @param clusterAwareRemoving  devices to remove from the cluster set
 * @param clusterAwareSetting   replacement for the cluster set
 */
public record ModifyOutputContextRequest(
        OutputContextType type,
        List<String> adding,
        List<String> removing,
        List<String> setting,
        List<String> clusterAwareAdding,
        List<String> clusterAwareRemoving,
        List<String> clusterAwareSetting
) implements ProtocolPayload
{
    public ModifyOutputContextRequest {
        adding = List.copyOf(Objects.requireNonNull(adding, "adding"));
        removing = List.copyOf(Objects.requireNonNull(removing, "removing"));
        setting = List.copyOf(Objects.requireNonNull(setting, "setting"));
        clusterAwareAdding = List.copyOf(Objects.requireNonNull(clusterAwareAdding, "clusterAwareAdding"));
        clusterAwareRemoving = List.copyOf(Objects.requireNonNull(clusterAwareRemoving, "clusterAwareRemoving"));
        clusterAwareSetting = List.copyOf(Objects.requireNonNull(clusterAwareSetting, "clusterAwareSetting"));
    }

    public Optional<OutputContextType> typeIfPresent() {
        return Optional.ofNullable(type);
    }

    /**
     * Request adding devices to the shared audio presentation, addressing both
     * the endpoint and its cluster.
     */
    public static ModifyOutputContextRequest addDevices(String... deviceIds) {
        List<String> ids = Arrays.asList(deviceIds);
        return builder()
                .type(OutputContextType.SHARED_AUDIO_PRESENTATION)
                .adding(ids)
                .clusterAwareAdding(ids)
                .build();
    }

    public static ModifyOutputContextRequest removeDevices(String... deviceIds) {
        List<String> ids = Arrays.asList(deviceIds);
        return builder()
                .type(OutputContextType.SHARED_AUDIO_PRESENTATION)
                .removing(ids)
                .clusterAwareRemoving(ids)
                .build();
    }

    public static ModifyOutputContextRequest setDevices(String... deviceIds) {
        List<String> ids = Arrays.asList(deviceIds);
        return builder()
                .type(OutputContextType.SHARED_AUDIO_PRESENTATION)
                .setting(ids)
                .clusterAwareSetting(ids)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private OutputContextType type;
        private final List<String> adding = new ArrayList<>();
        private final List<String> removing = new ArrayList<>();
        private final List<String> setting = new ArrayList<>();
        private final List<String> clusterAwareAdding = new ArrayList<>();
        private final List<String> clusterAwareRemoving = new ArrayList<>();
        private final List<String> clusterAwareSetting = new ArrayList<>();

        public Builder type(OutputContextType type) {
            this.type = type;
            return this;
        }

        public Builder adding(Collection<String> ids) {
            adding.addAll(ids);
            return this;
        }

        public Builder adding(String... ids) {
            return adding(Arrays.asList(ids));
        }

        public Builder removing(Collection<String> ids) {
            removing.addAll(ids);
            return this;
        }

        public Builder removing(String... ids) {
            return removing(Arrays.asList(ids));
        }

        public Builder setting(Collection<String> ids) {
            setting.addAll(ids);
            return this;
        }

        public Builder setting(String... ids) {
            return setting(Arrays.asList(ids));
        }

        public Builder clusterAwareAdding(Collection<String> ids) {
            clusterAwareAdding.addAll(ids);
            return this;
        }

        public Builder clusterAwareAdding(String... ids) {
            return clusterAwareAdding(Arrays.asList(ids));
        }

        public Builder clusterAwareRemoving(Collection<String> ids) {
            clusterAwareRemoving.addAll(ids);
            return this;
        }

        public Builder clusterAwareRemoving(String... ids) {
            return clusterAwareRemoving(Arrays.asList(ids));
        }

        public Builder clusterAwareSetting(Collection<String> ids) {
            clusterAwareSetting.addAll(ids);
            return this;
        }

        public Builder clusterAwareSetting(String... ids) {
            return clusterAwareSetting(Arrays.asList(ids));
        }

        public ModifyOutputContextRequest build() {
            return new ModifyOutputContextRequest(
                    type,
                    adding,
                    removing,
                    setting,
                    clusterAwareAdding,
                    clusterAwareRemoving,
                    clusterAwareSetting
            );
        }
    }
}
