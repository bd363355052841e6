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

import com.google.gson.JsonPrimitive;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Classes matching the IR wire format, version 0.1.0. Field names use {@code @SerializedName} for
 * the snake_case JSON names; fields are declared in the order they are written.
 *
 * <p>A null field is omitted from the JSON. {@link IrEmitter} relies on this to leave out optional
 * values and empty nested lists.
 */
public final class IrModel {

  private IrModel() {}

  public static class IrDocument {
    @SerializedName("version") public String version;
    @SerializedName("module")  public IrModule module;
  }

  public static class IrModule {
    @SerializedName("name")        public String name;
    @SerializedName("context")     public String context;
    @SerializedName("intent")      public IrIntent intent;
    @SerializedName("constraints") public IrConstraints constraints;
    // The remaining lists are always present, even when empty.
    @SerializedName("signals")     public List<IrSignal> signals;
    @SerializedName("coils")       public List<IrCoil> coils;
    @SerializedName("rungs")       public List<IrRung> rungs;
    @SerializedName("blocks")      public List<IrBlock> blocks;
    @SerializedName("networks")    public List<IrNetwork> networks;
  }

  public static class IrIntent {
    @SerializedName("goal") public String goal;
  }

  public static class IrConstraints {
    @SerializedName("data_privacy") public IrDataPrivacy dataPrivacy;
    @SerializedName("quality")      public IrQuality quality;
    @SerializedName("cost")         public IrCost cost;
  }

  public static class IrDataPrivacy {
    @SerializedName("jurisdiction") public String jurisdiction;
    @SerializedName("pii_handling") public String piiHandling;
  }

  public static class IrQuality {
    @SerializedName("min_precision") public Double minPrecision;
    @SerializedName("min_recall")    public Double minRecall;
  }

  public static class IrCost {
    @SerializedName("max_cost_per_submission") public String maxCostPerSubmission;
  }

  public static class IrSignal {
    @SerializedName("name")       public String name;
    @SerializedName("parameters") public List<String> parameters;
    @SerializedName("type")       public String type;
  }

  public static class IrCoil {
    @SerializedName("name")       public String name;
    @SerializedName("parameters") public List<String> parameters;
    @SerializedName("latching")   public Boolean latching;
    @SerializedName("critical")   public Boolean critical;
  }

  public static class IrRung {
    @SerializedName("name")    public String name;
    @SerializedName("guard")   public IrGuard guard;
    @SerializedName("actions") public List<IrAction> actions;
  }

  /**
   * A guard node. In JSON each node is an object whose first member is {@code "type"}, one of
   * {@code contact}, {@code and}, {@code or}, {@code not}; see {@link IrJson}.
   */
  public abstract static class IrGuard {
    IrGuard() {}

    /** The value of this node's {@code "type"} member. */
    public abstract String type();
  }

  public static class IrContact extends IrGuard {
    @SerializedName("name")         public String name;
    @SerializedName("contact_type") public String contactType;  // "NO" or "NC"
    @SerializedName("arguments")    public List<IrExpr> arguments;

    @Override
    public String type() {
      return "contact";
    }
  }

  public static class IrAnd extends IrGuard {
    @SerializedName("left")  public IrGuard left;
    @SerializedName("right") public IrGuard right;

    @Override
    public String type() {
      return "and";
    }
  }

  public static class IrOr extends IrGuard {
    @SerializedName("left")  public IrGuard left;
    @SerializedName("right") public IrGuard right;

    @Override
    public String type() {
      return "or";
    }
  }

  public static class IrNot extends IrGuard {
    @SerializedName("expr") public IrGuard expr;

    @Override
    public String type() {
      return "not";
    }
  }

  public static class IrAction {
    @SerializedName("action_type") public String actionType;  // energise, de_energise, ...
    @SerializedName("coil")        public String coil;
    @SerializedName("arguments")   public List<IrExpr> arguments;
  }

  /** An argument: {@code {"type": "string"|"number"|"boolean"|"identifier", "value": ...}}. */
  public static class IrExpr {
    @SerializedName("type")  public String type;
    @SerializedName("value") public JsonPrimitive value;
  }

  public static class IrBlock {
    @SerializedName("name")    public String name;
    @SerializedName("inputs")  public List<IrPort> inputs;
    @SerializedName("outputs") public List<IrPort> outputs;
    @SerializedName("effect")  public String effect;
  }

  public static class IrPort {
    @SerializedName("name") public String name;
    @SerializedName("type") public String type;
  }

  public static class IrNetwork {
    @SerializedName("name")    public String name;
    @SerializedName("wires")   public List<IrWire> wires;
    @SerializedName("outputs") public List<IrOutput> outputs;
  }

  public static class IrWire {
    @SerializedName("source") public String source;
    @SerializedName("target") public String target;
  }

  public static class IrOutput {
    @SerializedName("name")   public String name;
    @SerializedName("source") public String source;
  }
}
