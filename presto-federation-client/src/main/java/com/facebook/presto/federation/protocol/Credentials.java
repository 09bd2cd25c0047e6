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
package com.facebook.presto.federation.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import static java.util.Objects.requireNonNull;

public class Credentials
{
    private final String username;
    private final String password;

    @JsonCreator
    public Credentials(
            @JsonProperty("username") String username,
            @JsonProperty("password") String password)
    {
        this.username = requireNonNull(username, "username is null");
        this.password = requireNonNull(password, "password is null");
    }

    @JsonProperty
    public String getUsername()
    {
        return username;
    }

    @JsonProperty
    public String getPassword()
    {
        return password;
    }

    @Override
    public String toString()
    {
        // never print the password
        return username + ":***";
    }
}
