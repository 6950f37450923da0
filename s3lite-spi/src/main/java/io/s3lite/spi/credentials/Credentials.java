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
package io.s3lite.spi.credentials;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public record Credentials(String accessKey, String secretKey, Optional<String> session, String region, String service)
{
    public static final String DEFAULT_SERVICE = "s3";

    public Credentials
    {
        requireNonNull(accessKey, "accessKey is null");
        requireNonNull(secretKey, "secretKey is null");
        requireNonNull(session, "session is null");
        requireNonNull(region, "region is null");
        requireNonNull(service, "service is null");
        checkArgument(!accessKey.isBlank(), "accessKey is blank");
        checkArgument(!secretKey.isBlank(), "secretKey is blank");
        checkArgument(!region.isBlank(), "region is blank");
        checkArgument(!service.isBlank(), "service is blank");
    }

    public static Credentials build(String accessKey, String secretKey, String region)
    {
        return new Credentials(accessKey, secretKey, Optional.empty(), region, DEFAULT_SERVICE);
    }

    public static Credentials build(String accessKey, String secretKey, String session, String region)
    {
        return new Credentials(accessKey, secretKey, Optional.of(session), region, DEFAULT_SERVICE);
    }

    public Credentials withRegion(String region)
    {
        return new Credentials(accessKey, secretKey, session, region, service);
    }

    @Override
    public String toString()
    {
        // secret and session token never leave this record through logging
        return "Credentials[accessKey=%s, secretKey=***, session=%s, region=%s, service=%s]"
                .formatted(accessKey, session.map(ignore -> "***").orElse("<none>"), region, service);
    }
}
