package com.libragraph.drive.core.storage;

import com.libragraph.drive.util.BlobLocation;
import io.minio.BucketExistsArgs;
import io.minio.ComposeObjectArgs;
import io.minio.ComposeSource;
import io.minio.CopyObjectArgs;
import io.minio.CopySource;
import io.minio.GetObjectArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.ObjectWriteResponse;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.http.Method;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * S3/MinIO-backed BlobStore for production use.
 *
 * <p>Parts are staged as ordinary objects under {@code .multipart/{uploadId}/} in the target
 * bucket and assembled with a server-side compose on completion, after which the staged
 * objects are removed. Part tags are the staged objects' etags.
 */
@ApplicationScoped
@IfBuildProperty(name = "drive.blob-store.type", stringValue = "s3")
public class S3BlobStore implements BlobStore {

    private static final String STAGING_PREFIX = ".multipart/";

    @Inject
    MinioClient minioClient;

    private final ConcurrentHashMap<String, Boolean> knownBuckets = new ConcurrentHashMap<>();

    private static String partKey(MultipartHandle handle, int partNumber) {
        return STAGING_PREFIX + handle.uploadId() + "/" + String.format("%05d", partNumber);
    }

    private static String normalizeEtag(String etag) {
        return etag == null ? null : etag.replace("\"", "");
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code) || "NoSuchObject".equals(code);
    }

    private void ensureBucket(String bucket) {
        if (knownBuckets.containsKey(bucket)) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
        } catch (ErrorResponseException e) {
            // Concurrent creation, another thread already created the bucket
            if (!"BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                throw new StorageException("Failed to ensure bucket: " + bucket, e);
            }
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
        knownBuckets.put(bucket, Boolean.TRUE);
    }

    @Override
    public Uni<MultipartHandle> initiateMultipart(BlobLocation target) {
        return Uni.createFrom().item(() -> {
            ensureBucket(target.bucket());
            return new MultipartHandle(UUID.randomUUID().toString(), target);
        });
    }

    @Override
    public Uni<PartTag> uploadPart(MultipartHandle handle, int partNumber, byte[] data) {
        return Uni.createFrom().item(() -> {
            String bucket = handle.target().bucket();
            try {
                ObjectWriteResponse response = minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(partKey(handle, partNumber))
                        .stream(new ByteArrayInputStream(data), data.length, -1)
                        .contentType("application/octet-stream")
                        .build());
                return new PartTag(partNumber, normalizeEtag(response.etag()), data.length);
            } catch (Exception e) {
                throw new StorageException("Failed to upload part " + partNumber + " of " + handle.uploadId(), e);
            }
        });
    }

    @Override
    public Uni<Long> completeMultipart(MultipartHandle handle, List<PartTag> parts) {
        return Uni.createFrom().item(() -> {
            String bucket = handle.target().bucket();
            List<ComposeSource> sources = new ArrayList<>(parts.size());
            for (PartTag part : parts) {
                String key = partKey(handle, part.partNumber());
                StatObjectResponse stat;
                try {
                    stat = minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                } catch (ErrorResponseException e) {
                    if (isMissing(e)) {
                        throw new StorageException("Missing part " + part.partNumber() + " of " + handle.uploadId());
                    }
                    throw new StorageException("Failed to stat part " + part.partNumber(), e);
                } catch (Exception e) {
                    throw new StorageException("Failed to stat part " + part.partNumber(), e);
                }
                if (!normalizeEtag(stat.etag()).equals(part.tag())) {
                    throw new StorageException("Part " + part.partNumber() + " tag mismatch: expected "
                            + part.tag() + ", found " + normalizeEtag(stat.etag()));
                }
                sources.add(ComposeSource.builder().bucket(bucket).object(key).build());
            }
            try {
                minioClient.composeObject(ComposeObjectArgs.builder()
                        .bucket(bucket)
                        .object(handle.target().key())
                        .sources(sources)
                        .build());
                long size = minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket).object(handle.target().key()).build()).size();
                removeStaged(handle);
                return size;
            } catch (StorageException e) {
                throw e;
            } catch (Exception e) {
                throw new StorageException("Failed to complete multipart upload " + handle.uploadId(), e);
            }
        });
    }

    @Override
    public Uni<Void> abortMultipart(MultipartHandle handle) {
        return Uni.createFrom().voidItem().invoke(() -> removeStaged(handle));
    }

    private void removeStaged(MultipartHandle handle) {
        String bucket = handle.target().bucket();
        String prefix = STAGING_PREFIX + handle.uploadId() + "/";
        try {
            for (Result<Item> result : minioClient.listObjects(
                    ListObjectsArgs.builder().bucket(bucket).prefix(prefix).recursive(true).build())) {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(result.get().objectName()).build());
            }
        } catch (ErrorResponseException e) {
            if (!isMissing(e)) {
                throw new StorageException("Failed to remove staged parts of " + handle.uploadId(), e);
            }
        } catch (Exception e) {
            throw new StorageException("Failed to remove staged parts of " + handle.uploadId(), e);
        }
    }

    @Override
    public Uni<String> putObject(BlobLocation location, byte[] data, String contentType) {
        return Uni.createFrom().item(() -> {
            ensureBucket(location.bucket());
            try {
                ObjectWriteResponse response = minioClient.putObject(PutObjectArgs.builder()
                        .bucket(location.bucket())
                        .object(location.key())
                        .stream(new ByteArrayInputStream(data), data.length, -1)
                        .contentType(contentType != null ? contentType : "application/octet-stream")
                        .build());
                return normalizeEtag(response.etag());
            } catch (Exception e) {
                throw new StorageException("Failed to write blob: " + location, e);
            }
        });
    }

    @Override
    public Uni<InputStream> getObject(BlobLocation location) {
        return Uni.createFrom().item(() -> {
            try {
                return (InputStream) minioClient.getObject(GetObjectArgs.builder()
                        .bucket(location.bucket()).object(location.key()).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(location);
                }
                throw new StorageException("Failed to read blob: " + location, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read blob: " + location, e);
            }
        });
    }

    @Override
    public Uni<Void> copyObject(BlobLocation source, BlobLocation target) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket(target.bucket());
            try {
                minioClient.copyObject(CopyObjectArgs.builder()
                        .bucket(target.bucket())
                        .object(target.key())
                        .source(CopySource.builder().bucket(source.bucket()).object(source.key()).build())
                        .build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(source);
                }
                throw new StorageException("Failed to copy " + source + " to " + target, e);
            } catch (Exception e) {
                throw new StorageException("Failed to copy " + source + " to " + target, e);
            }
        });
    }

    @Override
    public Uni<Void> deleteObject(BlobLocation location) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // MinIO removeObject is silent on missing keys
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(location.bucket()).object(location.key()).build());
            } catch (ErrorResponseException e) {
                if (!isMissing(e)) {
                    throw new StorageException("Failed to delete blob: " + location, e);
                }
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + location, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(BlobLocation location) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(location.bucket()).object(location.key()).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("Failed to check existence: " + location, e);
            } catch (Exception e) {
                throw new StorageException("Failed to check existence: " + location, e);
            }
        });
    }

    @Override
    public Uni<URI> presignUpload(BlobLocation location, Duration ttl) {
        return presign(Method.PUT, location, ttl);
    }

    @Override
    public Uni<URI> presignDownload(BlobLocation location, Duration ttl) {
        return presign(Method.GET, location, ttl);
    }

    private Uni<URI> presign(Method method, BlobLocation location, Duration ttl) {
        return Uni.createFrom().item(() -> {
            try {
                String url = minioClient.getPresignedObjectUrl(GetPresignedObjectUrlArgs.builder()
                        .method(method)
                        .bucket(location.bucket())
                        .object(location.key())
                        .expiry((int) ttl.toSeconds(), TimeUnit.SECONDS)
                        .build());
                return URI.create(url);
            } catch (Exception e) {
                throw new StorageException("Failed to presign " + method + " for " + location, e);
            }
        });
    }

    @Override
    public Uni<Void> ping(String bucket) {
        return Uni.createFrom().voidItem().invoke(() -> ensureBucket(bucket));
    }
}
