@NamedInterface("dexcom")
package com.bko.glucosesync.integrations.dexcom;

import org.springframework.modulith.NamedInterface;
