package io.deedchain.core.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.deedchain.core.protocol.JsonCodec;
import io.deedchain.core.state.Column;
import io.deedchain.core.state.Columns;
import io.deedchain.core.state.RegistryStore;
import io.deedchain.core.state.WriteSet;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.DBOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persistent RegistryStore using RocksDB.
 *
 * One column family per registry column (see {@link Columns}); keys use the column's
 * key codec, values are Jackson JSON. A write set is applied as a single WriteBatch.
 */
public final class RocksDBRegistryStore implements RegistryStore, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(RocksDBRegistryStore.class.getName());

    static {
        RocksDB.loadLibrary();
    }

    private final RocksDB db;
    private final DBOptions dbOptions;
    private final List<ColumnFamilyHandle> handles;
    private final Map<Column<?, ?>, ColumnFamilyHandle> families;
    private final ObjectMapper mapper = JsonCodec.newMapper();

    private RocksDBRegistryStore(RocksDB db,
                                 DBOptions dbOptions,
                                 List<ColumnFamilyHandle> handles,
                                 Map<Column<?, ?>, ColumnFamilyHandle> families) {
        this.db = db;
        this.dbOptions = dbOptions;
        this.handles = handles;
        this.families = families;
    }

    /** Factory: open/create a store in the given directory path. */
    public static RocksDBRegistryStore open(String dataDir) {
        try {
            Files.createDirectories(Path.of(dataDir));
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create data dir " + dataDir, e);
        }
        DBOptions dbOpts = new DBOptions()
                .setCreateIfMissing(true)
                .setCreateMissingColumnFamilies(true);
        try {
            List<ColumnFamilyDescriptor> descriptors = new ArrayList<>();
            descriptors.add(new ColumnFamilyDescriptor(RocksDB.DEFAULT_COLUMN_FAMILY));
            for (Column<?, ?> column : Columns.ALL) {
                descriptors.add(new ColumnFamilyDescriptor(column.name().getBytes(StandardCharsets.UTF_8)));
            }
            List<ColumnFamilyHandle> handles = new ArrayList<>();
            RocksDB db = RocksDB.open(dbOpts, dataDir, descriptors, handles);

            // handle 0 is the default family
            Map<Column<?, ?>, ColumnFamilyHandle> families = new HashMap<>();
            for (int i = 0; i < Columns.ALL.size(); i++) {
                families.put(Columns.ALL.get(i), handles.get(i + 1));
            }
            LOG.info(() -> "Opened registry store at " + dataDir);
            return new RocksDBRegistryStore(db, dbOpts, handles, families);
        } catch (RocksDBException e) {
            dbOpts.close();
            throw new IllegalStateException("Failed to open RocksDB at " + dataDir, e);
        }
    }

    // -------------- RegistryStore API ----------------

    @Override
    public synchronized <K, V> Optional<V> get(Column<K, V> column, K key) {
        if (key == null) return Optional.empty();
        try {
            byte[] raw = db.get(family(column), column.encodeKey(key));
            if (raw == null) return Optional.empty();
            return Optional.of(mapper.readValue(raw, column.valueType()));
        } catch (RocksDBException e) {
            throw new IllegalStateException("get " + column.name() + " failed", e);
        } catch (IOException e) {
            throw new IllegalStateException("Corrupt value in " + column.name(), e);
        }
    }

    @Override
    public synchronized void write(WriteSet writes) {
        if (writes.isEmpty()) return;
        try (WriteOptions wo = new WriteOptions().setSync(false);
             WriteBatch batch = new WriteBatch()) {
            for (WriteSet.Put<?, ?> put : writes.puts()) {
                addPut(batch, put);
            }
            db.write(wo, batch);
        } catch (RocksDBException e) {
            throw new IllegalStateException("write batch of " + writes.size() + " puts failed", e);
        }
    }

    @Override
    public synchronized long size(Column<?, ?> column) {
        try (RocksIterator it = db.newIterator(family(column))) {
            long n = 0;
            for (it.seekToFirst(); it.isValid(); it.next()) n++;
            return n;
        }
    }

    @Override
    public synchronized void close() {
        for (ColumnFamilyHandle handle : handles) {
            handle.close();
        }
        try {
            db.closeE();
        } catch (RocksDBException e) {
            LOG.log(Level.WARNING, "Error closing registry store", e);
        } finally {
            dbOptions.close();
        }
    }

    // -------------- helpers ----------------

    private <K, V> void addPut(WriteBatch batch, WriteSet.Put<K, V> put) throws RocksDBException {
        Column<K, V> column = put.column();
        try {
            batch.put(family(column), column.encodeKey(put.key()), mapper.writeValueAsBytes(put.value()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode value for " + column.name(), e);
        }
    }

    private ColumnFamilyHandle family(Column<?, ?> column) {
        ColumnFamilyHandle handle = families.get(column);
        if (handle == null) {
            throw new IllegalArgumentException("Unknown column " + column.name());
        }
        return handle;
    }
}
