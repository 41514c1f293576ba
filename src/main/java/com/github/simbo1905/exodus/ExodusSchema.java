package com.github.simbo1905.exodus;

/// Names and fixed sizes of the Exodus II layout inside the container.
///
/// Per-entity names are suffixed with the 1-based slot index the allocator hands out, never
/// with the caller's external id.
final class ExodusSchema {

  private ExodusSchema() {}

  /// Version written to both `api_version` and `version`.
  static final float SCHEMA_VERSION = 6.30000019f;

  /// Longest name in bytes. The name slots are one wider so there is always a NUL terminator.
  static final int MAX_NAME_LENGTH = 32;

  static final int LEN_STRING = 33;
  static final int LEN_LINE = 81;
  static final int FOUR = 4;
  static final int LEN_NAME = MAX_NAME_LENGTH + 1;

  /// The time axis is fixed at creation and cannot grow.
  static final int TIME_STEPS = 1;

  /// Property array value of a slot that has not been claimed.
  static final int UNASSIGNED_ID = -1;

  static final int SLOT_FREE = 0;
  static final int SLOT_CLAIMED = 1;

  // file attributes
  static final String ATT_API_VERSION = "api_version";
  static final String ATT_VERSION = "version";
  static final String ATT_FLOATING_POINT_WORD_SIZE = "floating_point_word_size";
  static final String ATT_FILE_SIZE = "file_size";
  static final String ATT_MAXIMUM_NAME_LENGTH = "maximum_name_length";
  static final String ATT_INT64_STATUS = "int64_status";
  static final String ATT_TITLE = "title";
  static final String ATT_NAME = "name";
  static final String ATT_ELEM_TYPE = "elem_type";

  // fixed dimensions
  static final String DIM_LEN_STRING = "len_string";
  static final String DIM_LEN_LINE = "len_line";
  static final String DIM_FOUR = "four";
  static final String DIM_LEN_NAME = "len_name";
  static final String DIM_TIME_STEP = "time_step";

  // sized by the caller
  static final String DIM_NUM_DIM = "num_dim";
  static final String DIM_NUM_NODES = "num_nodes";
  static final String DIM_NUM_ELEM = "num_elem";
  static final String DIM_NUM_EL_BLK = "num_el_blk";
  static final String DIM_NUM_SIDE_SETS = "num_side_sets";
  static final String DIM_NUM_INFO = "num_info";

  static final String VAR_COOR_NAMES = "coor_names";
  static final String[] VAR_COORDS = {"coordx", "coordy", "coordz"};
  static final String VAR_EB_NAMES = "eb_names";
  static final String VAR_EB_STATUS = "eb_status";
  static final String VAR_EB_PROP1 = "eb_prop1";
  static final String VAR_SS_NAMES = "ss_names";
  static final String VAR_SS_STATUS = "ss_status";
  static final String VAR_SS_PROP1 = "ss_prop1";
  static final String VAR_TIME_WHOLE = "time_whole";
  static final String VAR_INFO_RECORDS = "info_records";

  static final String PROP_ID = "ID";

  static String numElemInBlock(int slot) {
    return "num_el_in_blk" + slot;
  }

  static String numNodesPerElem(int slot) {
    return "num_nod_per_el" + slot;
  }

  static String connect(int slot) {
    return "connect" + slot;
  }

  static String numSidesInSet(int slot) {
    return "num_side_ss" + slot;
  }

  static String elemSideSet(int slot) {
    return "elem_ss" + slot;
  }

  static String sideSideSet(int slot) {
    return "side_ss" + slot;
  }

  static String elementValues(int variableIndex, int blockSlot) {
    return "vals_elem_var" + variableIndex + "eb" + blockSlot;
  }

  static String nodeValues(int variableIndex) {
    return "vals_nod_var" + variableIndex;
  }
}
