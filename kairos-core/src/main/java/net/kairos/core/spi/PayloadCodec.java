package net.kairos.core.spi;

import net.kairos.core.model.TaskDescriptor;

/** TaskDescriptor ↔ 불투명 payload 바이트 */
public interface PayloadCodec {
    byte[] encode(TaskDescriptor task);

    /** 해석 불가하면 IllegalArgumentException */
    TaskDescriptor decode(byte[] payload);
}
