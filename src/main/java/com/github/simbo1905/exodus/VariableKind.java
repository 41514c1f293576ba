package com.github.simbo1905.exodus;

/// The three variable catalogs of an Exodus file. Each is sized once and keeps its names in a
/// `name_*` character array.
enum VariableKind {
  GLOBAL("global", "num_glo_var", "name_glo_var"),
  ELEMENT("element", "num_elem_var", "name_elem_var"),
  NODE("node", "num_nod_var", "name_nod_var");

  /// Single array holding every global variable, shaped (time_step, num_glo_var).
  static final String GLOBAL_VALUES = "vals_glo_var";

  final String label;
  final String countDimension;
  final String namesVariable;

  VariableKind(String label, String countDimension, String namesVariable) {
    this.label = label;
    this.countDimension = countDimension;
    this.namesVariable = namesVariable;
  }
}
