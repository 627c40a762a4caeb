/*
 * Copyright The AnyList Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Small utilities shared by the list implementation.
 *
 * <p>{@link io.github.anylist.util.Types} normalizes the type tags that
 * {@link io.github.anylist.list.HeterogeneousList} records for each value, so that primitive
 * class tokens such as {@code int.class} and their wrapper classes name the same tag, and
 * renders type tags for log and error messages.
 */
package io.github.anylist.util;
