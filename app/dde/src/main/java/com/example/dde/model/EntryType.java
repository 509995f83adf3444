package com.example.dde.model;

public enum EntryType {
  FIRST,
  SECOND
}
