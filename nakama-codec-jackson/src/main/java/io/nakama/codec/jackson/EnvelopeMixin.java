package io.nakama.codec.jackson;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.nakama.core.PayloadKind;

abstract class EnvelopeMixin {

    @JsonIgnore
    abstract PayloadKind kind();

    @JsonIgnore
    abstract boolean hasCollationId();
}
