/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.s3lite.client.xml;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * ListObjectsV2 response
 */
public final class ListBucketResult
{
    @JacksonXmlProperty(localName = "Name")
    String name;
    @JacksonXmlProperty(localName = "Prefix")
    String prefix;
    @JacksonXmlProperty(localName = "KeyCount")
    int keyCount;
    @JacksonXmlProperty(localName = "MaxKeys")
    int maxKeys;
    @JacksonXmlProperty(localName = "IsTruncated")
    boolean truncated;
    @JacksonXmlProperty(localName = "NextContinuationToken")
    String nextContinuationToken;
    @JacksonXmlProperty(localName = "Contents")
    @JacksonXmlElementWrapper(useWrapping = false)
    List<Contents> contents;

    public boolean truncated()
    {
        return truncated;
    }

    public Optional<String> nextContinuationToken()
    {
        return Optional.ofNullable(nextContinuationToken).filter(value -> !value.isEmpty());
    }

    public List<Contents> contents()
    {
        return contents == null ? ImmutableList.of() : ImmutableList.copyOf(contents);
    }

    public static final class Contents
    {
        @JacksonXmlProperty(localName = "Key")
        String key;
        @JacksonXmlProperty(localName = "LastModified")
        String lastModified;
        @JacksonXmlProperty(localName = "ETag")
        String eTag;
        @JacksonXmlProperty(localName = "Size")
        long size;
        @JacksonXmlProperty(localName = "StorageClass")
        String storageClass;

        public Optional<String> key()
        {
            return Optional.ofNullable(key);
        }

        public Optional<String> lastModified()
        {
            return Optional.ofNullable(lastModified);
        }

        public Optional<String> eTag()
        {
            return Optional.ofNullable(eTag);
        }

        public long size()
        {
            return size;
        }

        public Optional<String> storageClass()
        {
            return Optional.ofNullable(storageClass);
        }
    }
}
