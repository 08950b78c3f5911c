/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.grove.spi.store;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Set;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;
import java.util.zip.ZipException;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.apache.jackrabbit.grove.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An object database stored in a local {@code objects} directory.
 * <p>
 * Objects are kept loose, one zlib deflated file per object named by the hex
 * id split after the first byte ({@code ab/cdef...}). The file content is
 * {@code "<type> <length>\0"} followed by the object data.
 * <p>
 * The slow half looks for the loose file. The fast half answers from a
 * bounded cache of ids the slow half already found, so a repeated lookup of
 * the same object is answered before any alternate is searched. A cached id
 * is confirmed against its file and dropped once the file is gone.
 * <p>
 * Alternates are listed in {@code info/alternates}, one directory per line.
 * Relative lines are resolved against this {@code objects} directory; blank
 * lines and lines starting with {@code #} are ignored. An alternate pointing
 * back at this database or at one that (transitively) lists it as an
 * alternate is skipped.
 */
public class FileObjectDatabase extends ObjectDatabase implements ObjectInserter {

    private static final Logger LOG = LoggerFactory.getLogger(FileObjectDatabase.class);

    static final boolean UNPACKED_CACHE_ENABLED = SystemPropertySupplier
            .create("grove.store.unpackedCacheEnabled", Boolean.TRUE).loggingTo(LOG).get();

    static final int MAX_ALTERNATE_DEPTH = SystemPropertySupplier
            .create("grove.store.maxAlternateDepth", 5).loggingTo(LOG)
            .validateWith(n -> n >= 0).get();

    static final int UNPACKED_CACHE_SIZE = SystemPropertySupplier
            .create("grove.store.unpackedCacheSize", 10000).loggingTo(LOG)
            .validateWith(n -> n > 0).get();

    private final File objects;

    private final File infoDirectory;

    private final File alternatesFile;

    private final int depth;

    private final boolean cacheUnpacked;

    private final int cacheSize;

    /** Canonical directories of the databases this one is an alternate of. */
    private final Set<File> enclosing;

    private final Cache<ObjectId, Boolean> unpackedObjects;

    /**
     * Open the database rooted at the given {@code objects} directory. The
     * directory does not need to exist yet, see {@link #create()}.
     */
    public FileObjectDatabase(@NotNull File objects) {
        this(objects, 0, UNPACKED_CACHE_ENABLED);
    }

    FileObjectDatabase(@NotNull File objects, int depth, boolean cacheUnpacked) {
        this(objects, depth, cacheUnpacked, UNPACKED_CACHE_SIZE, ImmutableSet.<File>of());
    }

    FileObjectDatabase(@NotNull File objects, int depth, boolean cacheUnpacked, int cacheSize,
            @NotNull Set<File> enclosing) {
        checkArgument(cacheSize > 0, "cache size must be positive: %s", cacheSize);
        this.objects = checkNotNull(objects);
        this.infoDirectory = new File(objects, "info");
        this.alternatesFile = new File(infoDirectory, "alternates");
        this.depth = depth;
        this.cacheUnpacked = cacheUnpacked;
        this.cacheSize = cacheSize;
        this.enclosing = ImmutableSet.copyOf(enclosing);
        this.unpackedObjects = CacheBuilder.newBuilder().maximumSize(cacheSize).build();
    }

    /**
     * @return the {@code objects} directory of this database
     */
    @NotNull
    public File getDirectory() {
        return objects;
    }

    /**
     * @return the file listing the alternates of this database
     */
    @NotNull
    public File getAlternatesFile() {
        return alternatesFile;
    }

    @Override
    public boolean exists() {
        return objects.isDirectory();
    }

    @Override
    public void create() throws IOException {
        if (exists() && infoDirectory.isDirectory()) {
            return;
        }
        FileUtils.forceMkdir(objects);
        FileUtils.forceMkdir(infoDirectory);
        LOG.info("Created object database in {}", objects);
    }

    @Override
    public void closeSelf() {
        unpackedObjects.invalidateAll();
    }

    /**
     * Append an alternate to {@code info/alternates}. The alternate list is
     * reloaded on the next lookup.
     *
     * @param alternate the {@code objects} directory of the alternate
     */
    public void addAlternate(@NotNull File alternate) throws IOException {
        checkArgument(exists(), "%s does not exist", this);
        FileUtils.forceMkdir(infoDirectory);
        FileUtils.writeStringToFile(alternatesFile, alternate.getPath() + "\n", StandardCharsets.UTF_8, true);
        closeAlternates();
    }

    @Override
    public ObjectId insert(int type, @NotNull byte[] data) throws IOException {
        ObjectId id = ObjectId.forContent(type, data);
        File dst = fileFor(id.name());
        if (dst.isFile()) {
            return id;
        }
        FileUtils.forceMkdir(dst.getParentFile());
        File tmp = File.createTempFile("noz", null, objects);
        try {
            try (OutputStream out = new DeflaterOutputStream(new FileOutputStream(tmp))) {
                out.write(Constants.encode(Constants.typeString(type)));
                out.write(' ');
                out.write(Constants.encode(Integer.toString(data.length)));
                out.write(0);
                out.write(data);
            }
            moveIntoPlace(tmp, dst);
        } finally {
            FileUtils.deleteQuietly(tmp);
        }
        if (cacheUnpacked) {
            unpackedObjects.put(id, Boolean.TRUE);
        }
        return id;
    }

    private static void moveIntoPlace(File tmp, File dst) throws IOException {
        try {
            Files.move(tmp.toPath(), dst.toPath(), StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            try {
                Files.move(tmp.toPath(), dst.toPath());
            } catch (FileAlreadyExistsException alreadyWritten) {
                LOG.debug("{} was written concurrently", dst);
            }
        } catch (FileAlreadyExistsException alreadyWritten) {
            LOG.debug("{} was written concurrently", dst);
        }
    }

    @Override
    protected boolean hasObject1(AnyObjectId objectId) {
        if (!cacheUnpacked || unpackedObjects.getIfPresent(objectId) == null) {
            return false;
        }
        if (fileFor(objectId.name()).isFile()) {
            return true;
        }
        // removed behind our back; let the slow half decide
        unpackedObjects.invalidate(objectId);
        return false;
    }

    @Override
    protected boolean hasObject2(String objectName) {
        if (fileFor(objectName).isFile()) {
            remember(objectName);
            return true;
        }
        return false;
    }

    @Override
    protected ObjectLoader openObject1(WindowCursor curs, AnyObjectId objectId) throws IOException {
        if (!hasObject1(objectId)) {
            return null;
        }
        ObjectLoader ldr = openLoose(curs, objectId, fileFor(objectId.name()));
        if (ldr == null) {
            unpackedObjects.invalidate(objectId);
        } else {
            LOG.debug("{} opened from the unpacked cache of {}", objectId, this);
        }
        return ldr;
    }

    @Override
    protected ObjectLoader openObject2(WindowCursor curs, String objectName, AnyObjectId objectId)
            throws IOException {
        ObjectLoader ldr = openLoose(curs, objectId, fileFor(objectName));
        if (ldr != null) {
            remember(objectName);
        }
        return ldr;
    }

    private void remember(String objectName) {
        if (cacheUnpacked) {
            unpackedObjects.put(ObjectId.fromString(objectName), Boolean.TRUE);
        }
    }

    private ObjectLoader openLoose(WindowCursor curs, AnyObjectId id, File path) throws IOException {
        ByteArrayOutputStream raw = new ByteArrayOutputStream();
        try (InputStream in = new InflaterInputStream(new FileInputStream(path))) {
            IOUtils.copyLarge(in, raw, curs.tempBuffer(8192));
        } catch (FileNotFoundException noFile) {
            return null;
        } catch (ZipException e) {
            throw new CorruptObjectException(id, "bad zlib stream: " + e.getMessage());
        }
        return parseLoose(id, raw.toByteArray());
    }

    static ObjectLoader parseLoose(AnyObjectId id, byte[] buf) throws CorruptObjectException {
        int sp = indexOf(buf, (byte) ' ', 0);
        if (sp < 0) {
            throw new CorruptObjectException(id, "no type in header");
        }
        int type = Constants.typeCode(new String(buf, 0, sp, Constants.CHARSET));
        if (type == Constants.OBJ_BAD) {
            throw new CorruptObjectException(id, "invalid type");
        }
        int nul = indexOf(buf, (byte) 0, sp + 1);
        if (nul < 0) {
            throw new CorruptObjectException(id, "no length in header");
        }
        long size;
        try {
            size = Long.parseLong(new String(buf, sp + 1, nul - sp - 1, Constants.CHARSET));
        } catch (NumberFormatException e) {
            throw new CorruptObjectException(id, "invalid length");
        }
        int start = nul + 1;
        if (size != buf.length - start) {
            throw new CorruptObjectException(id, "length " + size + " does not match content of "
                    + (buf.length - start) + " bytes");
        }
        byte[] data = new byte[buf.length - start];
        System.arraycopy(buf, start, data, 0, data.length);
        return new ObjectLoader.SmallObject(type, data);
    }

    private static int indexOf(byte[] buf, byte b, int from) {
        for (int i = from; i < buf.length; i++) {
            if (buf[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private File fileFor(String objectName) {
        return new File(new File(objects, objectName.substring(0, 2)), objectName.substring(2));
    }

    @Override
    protected List<ObjectDatabase> loadAlternates() throws IOException {
        if (!alternatesFile.isFile()) {
            return NO_ALTERNATES;
        }
        if (depth >= MAX_ALTERNATE_DEPTH) {
            LOG.warn("Ignoring alternates of {}: nested more than {} levels deep", this, MAX_ALTERNATE_DEPTH);
            return NO_ALTERNATES;
        }
        File self = objects.getCanonicalFile();
        Set<File> chain = ImmutableSet.<File>builder().addAll(enclosing).add(self).build();
        List<ObjectDatabase> l = Lists.newArrayListWithCapacity(4);
        for (String line : FileUtils.readLines(alternatesFile, StandardCharsets.UTF_8)) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            File dir = new File(line);
            if (!dir.isAbsolute()) {
                dir = new File(objects, line);
            }
            dir = dir.getCanonicalFile();
            if (dir.equals(self)) {
                LOG.warn("Ignoring alternate {} of {}: refers to itself", line, this);
            } else if (enclosing.contains(dir)) {
                LOG.warn("Ignoring alternate {} of {}: cycles back to an enclosing database", line, this);
            } else if (!dir.isDirectory()) {
                LOG.warn("Ignoring alternate {} of {}: not a directory", line, this);
            } else {
                l.add(new FileObjectDatabase(dir, depth + 1, cacheUnpacked, cacheSize, chain));
            }
        }
        return l;
    }

    @Override
    public String toString() {
        return "FileObjectDatabase[" + objects + "]";
    }
}
