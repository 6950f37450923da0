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
package io.s3lite.spi.addressing;

public enum AddressStyle
{
    /**
     * Virtual hosted when the bucket name is a valid DNS label sequence, path style otherwise
     */
    AUTO,
    VIRTUAL_HOSTED,
    PATH_STYLE,
}
