// file: src/main/java/io/decaylite/storage/FileSnapshotter.java
package io.decaylite.storage;

import io.decaylite.core.Point;
import io.decaylite.core.PoolConfig;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation, one file per snapshot.
 * <p>
 * Format (big-endian, DataOutputStream):
 *   int32 MAGIC, byte VERSION
 *   int32 poolCount, repeated:   int64 poolId, bigint multiplier, int64 maxLockDuration
 *   int32 globalCount, repeated: int64 poolId, point
 *   int32 scheduleCount, repeated:
 *       int64 poolId, int32 entryCount, repeated: int64 epoch, bigint delta
 *   int32 userCount, repeated:   string user, int64 lockId, point
 *   int64 nextLockId
 * <p>
 *   point  = bigint bias, bigint slope, int64 period, int64 lastUpdate
 *   bigint = int32 len + two's-complement bytes
 *   string = int32 len + UTF-8 bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-&lt;ts&gt;.bin.tmp" first,
 *   - then move to "snapshot-&lt;ts&gt;.bin" using ATOMIC_MOVE.
 */
public final class FileSnapshotter implements Snapshotter {
    static final int MAGIC = 0xDECA7001;
    static final byte VERSION = 1;

    private final Path dir;

    public FileSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public String writeSnapshot(StoreImage image) {
        String name = "snapshot-" + System.currentTimeMillis() + ".bin";
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        try (var out = new DataOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING))) {
            out.writeInt(MAGIC);
            out.writeByte(VERSION);

            out.writeInt(image.poolConfigs().size());
            for (Map.Entry<Long, PoolConfig> e : image.poolConfigs().entrySet()) {
                out.writeLong(e.getKey());
                writeBig(out, e.getValue().multiplier());
                out.writeLong(e.getValue().maxLockDuration());
            }

            out.writeInt(image.globalPoints().size());
            for (Map.Entry<Long, Point> e : image.globalPoints().entrySet()) {
                out.writeLong(e.getKey());
                writePoint(out, e.getValue());
            }

            out.writeInt(image.slopeChanges().size());
            for (Map.Entry<Long, Map<Long, BigInteger>> e : image.slopeChanges().entrySet()) {
                out.writeLong(e.getKey());
                out.writeInt(e.getValue().size());
                for (Map.Entry<Long, BigInteger> se : e.getValue().entrySet()) {
                    out.writeLong(se.getKey());
                    writeBig(out, se.getValue());
                }
            }

            out.writeInt(image.userPoints().size());
            for (Map.Entry<UserLock, Point> e : image.userPoints().entrySet()) {
                writeString(out, e.getKey().user());
                out.writeLong(e.getKey().lockId());
                writePoint(out, e.getValue());
            }

            out.writeLong(image.nextLockId());
        } catch (IOException ex) { throw new RuntimeException("Failed to write snapshot " + tmp, ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new RuntimeException(e); }

        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        Path snap;
        try (Stream<Path> files = Files.list(dir)) {
            snap = files
                    .filter(p -> p.getFileName().toString().startsWith("snapshot-"))
                    .filter(p -> p.getFileName().toString().endsWith(".bin"))
                    .sorted()
                    .reduce((a, b) -> b)
                    .orElse(null);
        } catch (IOException e) { throw new RuntimeException(e); }

        if (snap == null) return null;

        try (var in = new DataInputStream(Files.newInputStream(snap))) {
            if (in.readInt() != MAGIC || in.readByte() != VERSION) {
                throw new IllegalStateException("Not a snapshot file: " + snap);
            }

            int poolCount = in.readInt();
            Map<Long, PoolConfig> configs = new HashMap<>(poolCount * 2);
            for (int i = 0; i < poolCount; i++) {
                long poolId = in.readLong();
                BigInteger multiplier = readBig(in);
                long maxLock = in.readLong();
                configs.put(poolId, new PoolConfig(multiplier, maxLock));
            }

            int globalCount = in.readInt();
            Map<Long, Point> globals = new HashMap<>(globalCount * 2);
            for (int i = 0; i < globalCount; i++) {
                long poolId = in.readLong();
                globals.put(poolId, readPoint(in));
            }

            int scheduleCount = in.readInt();
            Map<Long, Map<Long, BigInteger>> schedules = new HashMap<>(scheduleCount * 2);
            for (int i = 0; i < scheduleCount; i++) {
                long poolId = in.readLong();
                int entries = in.readInt();
                Map<Long, BigInteger> schedule = new HashMap<>(entries * 2);
                for (int j = 0; j < entries; j++) {
                    long epoch = in.readLong();
                    schedule.put(epoch, readBig(in));
                }
                schedules.put(poolId, schedule);
            }

            int userCount = in.readInt();
            Map<UserLock, Point> users = new HashMap<>(userCount * 2);
            for (int i = 0; i < userCount; i++) {
                String user = readString(in);
                long lockId = in.readLong();
                users.put(new UserLock(user, lockId), readPoint(in));
            }

            long nextLockId = in.readLong();
            var image = new StoreImage(configs, globals, schedules, users, nextLockId);
            return new LoadedSnapshot(snap.getFileName().toString(), image);
        } catch (IOException e) { throw new RuntimeException("Failed to read snapshot " + snap, e); }
    }

    private static void writePoint(DataOutputStream out, Point p) throws IOException {
        writeBig(out, p.bias());
        writeBig(out, p.slope());
        out.writeLong(p.period());
        out.writeLong(p.lastUpdate());
    }
    private static Point readPoint(DataInputStream in) throws IOException {
        BigInteger bias = readBig(in);
        BigInteger slope = readBig(in);
        long period = in.readLong();
        long lastUpdate = in.readLong();
        return new Point(bias, slope, period, lastUpdate);
    }
    private static void writeBig(DataOutputStream out, BigInteger v) throws IOException {
        byte[] b = v.toByteArray();
        out.writeInt(b.length);
        out.write(b);
    }
    private static BigInteger readBig(DataInputStream in) throws IOException {
        int len = in.readInt();
        return new BigInteger(in.readNBytes(len));
    }
    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }
    private static String readString(DataInputStream in) throws IOException {
        int len = in.readInt();
        byte[] b = in.readNBytes(len);
        return new String(b, StandardCharsets.UTF_8);
    }
}
