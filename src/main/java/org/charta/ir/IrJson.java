/*
 * Copyright 2025 The Charta Authors
 *
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

package org.charta.ir;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.charta.compiler.EmissionError;
import org.charta.ir.IrModel.IrAnd;
import org.charta.ir.IrModel.IrContact;
import org.charta.ir.IrModel.IrDocument;
import org.charta.ir.IrModel.IrExpr;
import org.charta.ir.IrModel.IrGuard;
import org.charta.ir.IrModel.IrNot;
import org.charta.ir.IrModel.IrOr;
import org.jspecify.annotations.Nullable;

/**
 * Reads and writes IR documents as JSON.
 *
 * <p>Null fields are omitted and HTML characters are not escaped. Guard nodes are written with a
 * leading {@code "type"} member, followed by the node's own fields in declaration order.
 *
 * <p>The Gson instances are immutable, so a single IrJson may be shared between threads.
 */
public final class IrJson {

  private static final IrJson PRETTY = new IrJson(true);
  private static final IrJson COMPACT = new IrJson(false);

  /** Returns the shared instance for the given output style. */
  public static IrJson get(boolean prettyPrint) {
    return prettyPrint ? PRETTY : COMPACT;
  }

  private final Gson gson;

  private IrJson(boolean prettyPrint) {
    GsonBuilder builder =
        new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(IrGuard.class, new GuardAdapter());
    if (prettyPrint) {
      builder.setPrettyPrinting();
    }
    this.gson = builder.create();
  }

  /** Serializes {@code document}, throwing an {@link EmissionError} if that fails. */
  public String write(IrDocument document) {
    try {
      return gson.toJson(document);
    } catch (JsonIOException | IllegalArgumentException e) {
      throw new EmissionError("JSON serialization error: " + e.getMessage(), e);
    }
  }

  /**
   * Parses an IR document.
   *
   * @throws JsonParseException if {@code json} is malformed or has an unknown guard type
   */
  public IrDocument read(String json) {
    return gson.fromJson(json, IrDocument.class);
  }

  /**
   * Streams guard trees with an explicit stack rather than recursion, since a chain of {@code AND}
   * or {@code OR} nests once per operator and guards have no depth limit.
   */
  private static class GuardAdapter extends TypeAdapter<IrGuard> {

    /** Pushed after a node's children; popping it closes the node's object. */
    private static final Object END_OBJECT = new Object();

    @Override
    public void write(JsonWriter out, @Nullable IrGuard guard) throws IOException {
      if (guard == null) {
        out.nullValue();
        return;
      }
      // Each entry is a guard to write, a member name, or END_OBJECT.
      Deque<Object> stack = new ArrayDeque<>();
      stack.push(guard);
      while (!stack.isEmpty()) {
        Object item = stack.pop();
        if (item == END_OBJECT) {
          out.endObject();
        } else if (item instanceof String name) {
          out.name(name);
        } else {
          IrGuard node = (IrGuard) item;
          out.beginObject();
          out.name("type").value(node.type());
          if (node instanceof IrContact contact) {
            writeContactFields(out, contact);
            out.endObject();
            continue;
          }
          // Pushed in reverse, so that they pop in declaration order.
          stack.push(END_OBJECT);
          if (node instanceof IrAnd and) {
            pushMember(stack, "right", and.right);
            pushMember(stack, "left", and.left);
          } else if (node instanceof IrOr or) {
            pushMember(stack, "right", or.right);
            pushMember(stack, "left", or.left);
          } else {
            pushMember(stack, "expr", ((IrNot) node).expr);
          }
        }
      }
    }

    private static void pushMember(Deque<Object> stack, String name, @Nullable IrGuard child) {
      if (child != null) {
        stack.push(child);
        stack.push(name);
      }
    }

    private static void writeContactFields(JsonWriter out, IrContact contact) throws IOException {
      if (contact.name != null) {
        out.name("name").value(contact.name);
      }
      if (contact.contactType != null) {
        out.name("contact_type").value(contact.contactType);
      }
      if (contact.arguments != null) {
        out.name("arguments").beginArray();
        for (IrExpr arg : contact.arguments) {
          out.beginObject();
          out.name("type").value(arg.type);
          if (arg.value != null) {
            out.name("value");
            writePrimitive(out, arg.value);
          }
          out.endObject();
        }
        out.endArray();
      }
    }

    private static void writePrimitive(JsonWriter out, JsonPrimitive value) throws IOException {
      if (value.isBoolean()) {
        out.value(value.getAsBoolean());
      } else if (value.isNumber()) {
        out.value(value.getAsNumber());
      } else {
        out.value(value.getAsString());
      }
    }

    @Override
    public @Nullable IrGuard read(JsonReader in) throws IOException {
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      JsonElement json = JsonParser.parseReader(in);
      IrGuard root = newNode(json);
      // Each node is created when its parent is reached, and filled in when it is popped.
      Deque<JsonObject> pendingJson = new ArrayDeque<>();
      Deque<IrGuard> pendingNodes = new ArrayDeque<>();
      pendingJson.push(json.getAsJsonObject());
      pendingNodes.push(root);
      while (!pendingNodes.isEmpty()) {
        JsonObject object = pendingJson.pop();
        IrGuard node = pendingNodes.pop();
        if (node instanceof IrContact contact) {
          readContactFields(object, contact);
        } else if (node instanceof IrAnd and) {
          and.left = child(object, "left", pendingJson, pendingNodes);
          and.right = child(object, "right", pendingJson, pendingNodes);
        } else if (node instanceof IrOr or) {
          or.left = child(object, "left", pendingJson, pendingNodes);
          or.right = child(object, "right", pendingJson, pendingNodes);
        } else {
          ((IrNot) node).expr = child(object, "expr", pendingJson, pendingNodes);
        }
      }
      return root;
    }

    private static @Nullable IrGuard child(
        JsonObject parent,
        String name,
        Deque<JsonObject> pendingJson,
        Deque<IrGuard> pendingNodes) {
      JsonElement json = parent.get(name);
      if (json == null || json.isJsonNull()) {
        return null;
      }
      IrGuard node = newNode(json);
      pendingJson.push(json.getAsJsonObject());
      pendingNodes.push(node);
      return node;
    }

    /** Returns an empty node of the class named by {@code json}'s type tag. */
    private static IrGuard newNode(JsonElement json) {
      if (!json.isJsonObject()) {
        throw new JsonParseException("Guard must be an object: " + json);
      }
      JsonElement tag = json.getAsJsonObject().get("type");
      if (tag == null || !tag.isJsonPrimitive()) {
        throw new JsonParseException("Guard has no type: " + json);
      }
      return switch (tag.getAsString()) {
        case "contact" -> new IrContact();
        case "and" -> new IrAnd();
        case "or" -> new IrOr();
        case "not" -> new IrNot();
        default -> throw new JsonParseException("Unknown guard type: " + tag.getAsString());
      };
    }

    private static void readContactFields(JsonObject object, IrContact contact) {
      contact.name = stringMember(object, "name");
      contact.contactType = stringMember(object, "contact_type");
      JsonElement arguments = object.get("arguments");
      if (arguments != null && !arguments.isJsonNull()) {
        List<IrExpr> result = new ArrayList<>();
        for (JsonElement element : arguments.getAsJsonArray()) {
          JsonObject argument = element.getAsJsonObject();
          IrExpr expr = new IrExpr();
          expr.type = stringMember(argument, "type");
          JsonElement value = argument.get("value");
          if (value != null && !value.isJsonNull()) {
            expr.value = value.getAsJsonPrimitive();
          }
          result.add(expr);
        }
        contact.arguments = result;
      }
    }

    private static @Nullable String stringMember(JsonObject object, String name) {
      JsonElement member = object.get(name);
      return (member == null || member.isJsonNull()) ? null : member.getAsString();
    }
  }
}
