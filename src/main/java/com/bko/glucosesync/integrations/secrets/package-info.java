@NamedInterface("secrets")
package com.bko.glucosesync.integrations.secrets;

import org.springframework.modulith.NamedInterface;
