// This file is part of OpenTSDB.
// Copyright (C) 2022  The OpenTSDB Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.metricsplit.utils;

import java.io.IOException;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Static initialization and configuration of the Jackson ObjectMapper shared
 * by the project, along with wrappers for the common (de)serialization calls.
 * The mapper is thread safe and expensive to build, so it's created once.
 *
 * @since 1.0
 */
public final class JSON {

  /** Jackson de/serializer initialized, configured and shared. */
  private static final ObjectMapper jsonMapper = new ObjectMapper();
  static {
    // NaN values are legitimate sample values.
    jsonMapper.configure(JsonParser.Feature.ALLOW_NON_NUMERIC_NUMBERS, true);
    jsonMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  private JSON() {
    // static helpers only
  }

  /**
   * Deserializes a JSON formatted string to a specific class type.
   * @param json The string to deserialize
   * @param pojo The class type of the object used for deserialization
   * @return An object of the {@code pojo} type
   * @throws IllegalArgumentException if the data or class was null or parsing
   * failed
   * @throws JSONException if the data could not be read
   */
  public static final <T> T parseToObject(final String json,
                                          final Class<T> pojo) {
    if (json == null || json.isEmpty()) {
      throw new IllegalArgumentException("Incoming data was null or empty");
    }
    if (pojo == null) {
      throw new IllegalArgumentException("Missing class type");
    }
    try {
      return jsonMapper.readValue(json, pojo);
    } catch (JsonParseException e) {
      throw new IllegalArgumentException(e);
    } catch (JsonMappingException e) {
      throw new IllegalArgumentException(e);
    } catch (IOException e) {
      throw new JSONException(e);
    }
  }

  /**
   * Serializes the given object to a JSON string.
   * @param object The object to serialize
   * @return A JSON formatted string
   * @throws IllegalArgumentException if the object was null
   * @throws JSONException if the object could not be serialized
   */
  public static final String serializeToString(final Object object) {
    if (object == null) {
      throw new IllegalArgumentException("Object was null");
    }
    try {
      return jsonMapper.writeValueAsString(object);
    } catch (JsonProcessingException e) {
      throw new JSONException(e);
    }
  }

  /** @return The shared ObjectMapper instance. */
  public static final ObjectMapper getMapper() {
    return jsonMapper;
  }
}
