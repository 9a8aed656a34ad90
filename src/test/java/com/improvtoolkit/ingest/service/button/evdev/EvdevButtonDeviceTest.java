package com.improvtoolkit.ingest.service.button.evdev;

import com.improvtoolkit.ingest.exception.DeviceUnavailableException;
import com.improvtoolkit.ingest.service.button.ButtonDevice;
import com.improvtoolkit.ingest.service.button.ButtonInputEvent;
import com.improvtoolkit.ingest.service.button.KeyCode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Pipe;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EvdevButtonDeviceTest {

    private static final int EV_SYN = 0x00;
    private static final int EV_MSC = 0x04;

    private static ByteBuffer records(int[]... events) {
        ByteBuffer buf = ByteBuffer.allocate(EvdevButtonDevice.EVENT_SIZE * events.length)
                .order(ByteOrder.nativeOrder());
        for (int[] e : events) {
            buf.putLong(e[0]).putLong(e[1]).putShort((short) e[2]).putShort((short) e[3]).putInt(e[4]);
        }
        buf.flip();
        return buf;
    }

    @Test
    void decodesKeyTransitions() {
        ByteBuffer buf = records(
                new int[]{1_700_000, 250_999, EvdevButtonDevice.EV_KEY, KeyCode.KEY_R.code(), 1},
                new int[]{1_700_000, 300_000, EvdevButtonDevice.EV_KEY, KeyCode.KEY_R.code(), 2},
                new int[]{1_700_001, 0, EvdevButtonDevice.EV_KEY, KeyCode.KEY_R.code(), 0});

        ButtonInputEvent down = EvdevButtonDevice.decode(buf).orElseThrow();
        ButtonInputEvent repeat = EvdevButtonDevice.decode(buf).orElseThrow();
        ButtonInputEvent up = EvdevButtonDevice.decode(buf).orElseThrow();

        assertThat(down.state()).isEqualTo(ButtonInputEvent.State.DOWN);
        assertThat(down.key()).contains(KeyCode.KEY_R);
        assertThat(down.whenMillis()).isEqualTo(1_700_000_250L);
        assertThat(repeat.state()).isEqualTo(ButtonInputEvent.State.REPEAT);
        assertThat(up.state()).isEqualTo(ButtonInputEvent.State.UP);
        assertThat(buf.hasRemaining()).isFalse();
    }

    @Test
    void skipsNonKeyRecords() {
        ByteBuffer buf = records(
                new int[]{0, 0, EV_MSC, 4, 458_773},
                new int[]{0, 0, EV_SYN, 0, 0},
                new int[]{0, 0, EvdevButtonDevice.EV_KEY, KeyCode.KEY_R.code(), 7});

        assertThat(EvdevButtonDevice.decode(buf)).isEmpty();
        assertThat(EvdevButtonDevice.decode(buf)).isEmpty();
        assertThat(EvdevButtonDevice.decode(buf)).isEmpty();
    }

    @Test
    void readerDeliversRecordsSplitAcrossWrites() throws IOException, InterruptedException {
        Pipe pipe = Pipe.open();
        EvdevButtonDevice device = new EvdevButtonDevice("/dev/input/event9", pipe.source());
        device.start();
        try {
            ByteBuffer buf = records(
                    new int[]{10, 0, EvdevButtonDevice.EV_KEY, KeyCode.KEY_SPACE.code(), 1},
                    new int[]{10, 0, EV_SYN, 0, 0});
            ByteBuffer head = buf.duplicate();
            head.limit(10);
            ByteBuffer tail = buf.duplicate();
            tail.position(10);
            pipe.sink().write(head);
            pipe.sink().write(tail);

            Optional<ButtonInputEvent> event = device.poll(Duration.ofSeconds(2));

            assertThat(event).flatMap(ButtonInputEvent::key).contains(KeyCode.KEY_SPACE);
            assertThat(device.poll(Duration.ofMillis(20))).isEmpty();
        } finally {
            device.close();
            pipe.sink().close();
        }
    }

    @Test
    void endOfStreamSurfacesAsUnavailable() throws IOException, InterruptedException {
        Pipe pipe = Pipe.open();
        EvdevButtonDevice device = new EvdevButtonDevice("/dev/input/event9", pipe.source());
        device.start();

        pipe.sink().close();

        Thread.sleep(50);
        assertThatThrownBy(() -> device.poll(Duration.ofMillis(50)))
                .isInstanceOf(DeviceUnavailableException.class)
                .hasMessageContaining("device stream ended");
        device.close();
    }

    @Test
    void missingDeviceFailsOpen(@TempDir Path dir) {
        EvdevButtonDriver driver = new EvdevButtonDriver("avatar-1", dir.resolve("event42").toString(), true);

        assertThatThrownBy(driver::open)
                .isInstanceOf(DeviceUnavailableException.class)
                .hasMessageContaining("no such device");
    }

    @Test
    void regularFileOpensAsDevice(@TempDir Path dir) throws IOException, InterruptedException {
        Path file = dir.resolve("event0");
        ByteBuffer buf = records(new int[]{1, 0, EvdevButtonDevice.EV_KEY, KeyCode.KEY_U.code(), 1});
        byte[] bytes = new byte[buf.remaining()];
        buf.get(bytes);
        Files.write(file, bytes);
        EvdevButtonDriver driver = new EvdevButtonDriver("avatar-1", file.toString(), false);

        ButtonDevice device = driver.open();
        try {
            assertThat(device.path()).isEqualTo(file.toString());
            assertThat(device.poll(Duration.ofSeconds(2))).map(ButtonInputEvent::rawCode)
                    .contains(KeyCode.KEY_U.code());
        } finally {
            driver.close(device);
        }
    }
}
